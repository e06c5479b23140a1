package com.ryuqq.raii.testkit.contract;

import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.testkit.fixture.CannotOpenResourceTwiceException;
import com.ryuqq.raii.testkit.fixture.FakeResource;
import com.ryuqq.raii.testkit.fixture.IdGenerators;
import com.ryuqq.raii.testkit.fixture.RecordingResource;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: sequential composition (flatMap).
 *
 * <p>Validates that resources acquired through a value-dependent chain are released in reverse
 * order of acquisition and that the chained value behaves like plain function application.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Nested r0/r1 → acquire r0, acquire r1, release r1, release r0</li>
 *   <li>Reentrant factory reused inside itself → ids "0" and "1" both opened then closed</li>
 *   <li>Constant id reused inside itself → conflict, "r0" stays open</li>
 * </ul>
 *
 * @param <F> host effect witness type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class SequentialCompositionContract<F> extends AbstractResourceContractTest<F> {

    @Test
    void testRun_SingleManagedResource_AcquiredAndReleased() {
        // Given
        ResourceFactory<F, FakeResource> r0 = exclusive("r0");
        ResourceFactory<F, String> observed = sequential().map(r0, resource -> {
            assertOpen("r0");
            return resource.id();
        });

        // When
        String id = awaitValue(sequential().run(observed));

        // Then
        assertEquals("r0", id);
        assertEvents("acquire r0", "release r0");
        assertNoLeak();
    }

    @Test
    void testFactory_IsADescription_NothingAcquiredUntilRun() {
        // Given
        ResourceFactory<F, FakeResource> r0 = exclusive("r0");

        // When
        sequential().flatMap(r0, first -> exclusive("r1"));

        // Then
        assertTrue(events.events().isEmpty());
        assertNoLeak();
    }

    @Test
    void testValueLaw_BindToPure_EqualsFunctionApplication() {
        // Given
        Function<String, Integer> g = name -> name.length() * 10;
        ResourceFactory<F, RecordingResource> source = recording("value-law");

        // When
        String plain = awaitValue(sequential().run(sequential().map(source, RecordingResource::name)));
        Integer bound = awaitValue(sequential().run(
            sequential().flatMap(source, resource -> sequential().pure(g.apply(resource.name())))));

        // Then
        assertEquals(g.apply(plain), bound);
    }

    @Test
    void testNestedResources_ReleasedInReverseOrder() {
        // Given
        ResourceFactory<F, FakeResource> r0 = exclusive("r0");
        ResourceFactory<F, FakeResource> r1 = exclusive("r1");

        ResourceFactory<F, FakeResource> nested = sequential().flatMap(r0, first -> {
            assertOpen("r0");
            return sequential().map(r1, second -> {
                assertOpen("r1");
                return second;
            });
        });

        // When
        FakeResource result = awaitValue(sequential().run(nested));

        // Then
        assertEquals("r1", result.id());
        assertEvents("acquire r0", "acquire r1", "release r1", "release r0");
        assertNoLeak();
    }

    @Test
    void testThreeLevels_ReleasedInReverseOrder() {
        // Given
        ResourceFactory<F, String> chain = sequential().flatMap(recording("a"), a ->
            sequential().flatMap(recording("b"), b ->
                sequential().map(recording("c"), c -> a.name() + b.name() + c.name())));

        // When
        String result = awaitValue(sequential().run(chain));

        // Then
        assertEquals("abc", result);
        assertEvents("acquire a", "acquire b", "acquire c", "release c", "release b", "release a");
    }

    @Test
    void testReentrantFactory_FreshIds_BothReleased() {
        // Given
        ResourceFactory<F, FakeResource> shared = reentrant(IdGenerators.sequential());

        ResourceFactory<F, FakeResource> twice = sequential().flatMap(shared, first -> {
            assertOpen("0");
            return sequential().map(shared, second -> {
                assertOpen("0");
                assertOpen("1");
                return second;
            });
        });

        // When
        FakeResource result = awaitValue(sequential().run(twice));

        // Then
        assertEquals("1", result.id());
        assertEvents("acquire 0", "acquire 1", "release 1", "release 0");
        assertNoLeak();
    }

    @Test
    void testExclusiveFactory_ReusedInsideItself_ConflictLeavesResourceOpen() {
        // Given
        ResourceFactory<F, FakeResource> r0 = exclusive("r0");
        ResourceFactory<F, FakeResource> twice = sequential().flatMap(r0, first -> sequential().map(r0, second -> second));

        // When
        Throwable failure = awaitFailure(sequential().run(twice));

        // Then
        assertInstanceOf(CannotOpenResourceTwiceException.class, failure);
        assertOpen("r0");
        assertEvents("acquire r0");
    }

    @Test
    void testManaged_ConstructorEvaluatedOnEveryAcquisition() {
        // Given
        AtomicInteger constructed = new AtomicInteger();
        Supplier<String> ids = IdGenerators.sequential();
        ResourceFactory<F, FakeResource> counted = sequential().managed(() -> {
            constructed.incrementAndGet();
            return new FakeResource(table, events, ids);
        });

        // When
        awaitValue(sequential().run(counted));
        awaitValue(sequential().run(counted));

        // Then
        assertEquals(2, constructed.get());
        assertEvents("acquire 0", "release 0", "acquire 1", "release 1");
    }

    @Test
    void testUsing_ContinuationRunsWhileResourceIsOpen() {
        // Given
        ResourceFactory<F, FakeResource> r0 = exclusive("r0");

        // When
        String result = awaitValue(sequential().using(r0, resource ->
            harness.effects().point(() -> {
                assertOpen("r0");
                events.record("use " + resource.id());
                return resource.id();
            })));

        // Then
        assertEquals("r0", result);
        assertEvents("acquire r0", "use r0", "release r0");
        assertNoLeak();
    }

    @Test
    void testFlatten_ReleasesBothLayers() {
        // Given
        ResourceFactory<F, ResourceFactory<F, RecordingResource>> outer =
            sequential().map(recording("outer"), ignored -> recording("inner"));

        // When
        RecordingResource result = awaitValue(sequential().run(sequential().flatten(outer)));

        // Then
        assertEquals("inner", result.name());
        assertEvents("acquire outer", "acquire inner", "release inner", "release outer");
    }

    @Test
    void testLiftAndPure_NoReleaseOwed() {
        // Given
        ResourceFactory<F, Integer> lifted = sequential().liftEffect(harness.effects().point(() -> 20));
        ResourceFactory<F, Integer> sum = sequential().flatMap(lifted, a ->
            sequential().map(sequential().pure(22), b -> a + b));

        // When
        Integer result = awaitValue(sequential().run(sum));

        // Then
        assertEquals(42, result);
        assertTrue(events.events().isEmpty());
    }
}
