package com.ryuqq.raii.testkit.contract;

import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.testkit.fixture.FakeResource;
import com.ryuqq.raii.testkit.fixture.IdGenerators;
import com.ryuqq.raii.testkit.fixture.RecordingResource;
import com.ryuqq.raii.testkit.fixture.ReleaseFailedException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: independent composition (ap / map2).
 *
 * <p>Both sides are acquired through the host's independent combination, which may run them
 * concurrently. No release order is asserted between the two sides; only that each is released
 * exactly once and nothing stays open.</p>
 *
 * <p>The error-aware instance adds failure paths: when one side fails to acquire, the side that
 * did acquire is released before the error escapes, and a failing release never prevents the
 * other side's release. When both sides fail, the left side's error is reported.</p>
 *
 * @param <F> host effect witness type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class IndependentCompositionContract<F> extends AbstractResourceContractTest<F> {

    private static final IllegalStateException BOOM = new IllegalStateException("boom");

    @Test
    void testMap2_UnrelatedResources_BothReleased() {
        // Given
        ResourceFactory<F, String> pair = sequential().map2(exclusive("r0"), exclusive("r1"),
            (left, right) -> left.id() + "+" + right.id());

        // When
        String result = awaitValue(sequential().run(pair));

        // Then
        assertEquals("r0+r1", result);
        assertReleasedOnce("r0");
        assertReleasedOnce("r1");
        assertEquals(Set.of("acquire r0", "acquire r1", "release r0", "release r1"), new HashSet<>(events.events()));
        assertNoLeak();
    }

    @Test
    void testAp_FunctionFactoryAppliedToValue() {
        // Given
        ResourceFactory<F, Function<? super FakeResource, ? extends String>> describe =
            sequential().map(exclusive("fn"), fn -> resource -> fn.id() + "(" + resource.id() + ")");

        // When
        String result = awaitValue(sequential().run(sequential().ap(exclusive("arg"), describe)));

        // Then
        assertEquals("fn(arg)", result);
        assertReleasedOnce("fn");
        assertReleasedOnce("arg");
        assertNoLeak();
    }

    @Test
    void testMap2_SameReentrantFactory_DistinctIdsBothReleased() {
        // Given
        ResourceFactory<F, FakeResource> shared = reentrant(IdGenerators.sequential());
        ResourceFactory<F, Set<String>> ids = sequential().map2(shared, shared,
            (left, right) -> Set.of(left.id(), right.id()));

        // When
        Set<String> result = awaitValue(sequential().run(ids));

        // Then
        assertEquals(Set.of("0", "1"), result);
        assertReleasedOnce("0");
        assertReleasedOnce("1");
        assertNoLeak();
    }

    @Test
    void testMap2_InsideSequentialChain_AllReleased() {
        // Given
        ResourceFactory<F, String> chain = sequential().flatMap(exclusive("outer"), outer ->
            sequential().map2(exclusive("left"), exclusive("right"),
                (left, right) -> outer.id() + ":" + left.id() + "," + right.id()));

        // When
        String result = awaitValue(sequential().run(chain));

        // Then
        assertEquals("outer:left,right", result);
        assertEquals("release outer", events.events().get(events.events().size() - 1));
        assertNoLeak();
    }

    @Test
    void testMap2_ErrorAware_RightAcquisitionFails_LeftReleased() {
        // Given
        ResourceFactory<F, FakeResource> failing = errorAware().raiseError(BOOM);
        ResourceFactory<F, String> pair = errorAware().map2(exclusive("r0"), failing,
            (left, right) -> left.id() + "+" + right.id());

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        assertSame(BOOM, failure);
        assertEvents("acquire r0", "release r0");
        assertNoLeak();
    }

    @Test
    void testMap2_ErrorAware_LeftAcquisitionFails_RightReleased() {
        // Given
        ResourceFactory<F, FakeResource> failing = errorAware().raiseError(BOOM);
        ResourceFactory<F, String> pair = errorAware().map2(failing, exclusive("r1"),
            (left, right) -> left.id() + "+" + right.id());

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        assertSame(BOOM, failure);
        assertEvents("acquire r1", "release r1");
        assertNoLeak();
    }

    @Test
    void testMap2_ErrorAware_BothAcquisitionsFail_LeftErrorReported() {
        // Given
        IllegalStateException rightBoom = new IllegalStateException("right boom");
        ResourceFactory<F, String> pair = errorAware().map2(
            errorAware().<FakeResource>raiseError(BOOM), errorAware().<FakeResource>raiseError(rightBoom),
            (left, right) -> left.id() + "+" + right.id());

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        assertSame(BOOM, failure);
        assertTrue(events.events().isEmpty());
    }

    @Test
    void testMap2_ErrorAware_AcquisitionFailsAndReleaseFails_ReleaseErrorWins() {
        // Given
        ResourceFactory<F, String> pair = errorAware().map2(failingOnRelease("r0"),
            errorAware().<RecordingResource>raiseError(BOOM), (left, right) -> left.name() + "+" + right.name());

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r0", releaseFailure.getResourceName());
        assertReleasedOnce("r0");
    }

    @Test
    void testMap2_ErrorAware_LeftReleaseFails_RightStillReleased() {
        // Given
        ResourceFactory<F, String> pair = errorAware().map2(failingOnRelease("r0"), recording("r1"),
            (left, right) -> left.name() + "+" + right.name());

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r0", releaseFailure.getResourceName());
        assertReleasedOnce("r0");
        assertReleasedOnce("r1");
    }

    @Test
    void testMap2_ErrorAware_RightReleaseFails_LeftStillReleased() {
        // Given
        ResourceFactory<F, String> pair = errorAware().map2(recording("r0"), failingOnRelease("r1"),
            (left, right) -> left.name() + "+" + right.name());

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r1", releaseFailure.getResourceName());
        assertReleasedOnce("r0");
        assertReleasedOnce("r1");
    }

    @Test
    void testMap2_ErrorAware_BothReleasesFail_LeftReleaseErrorWins() {
        // Given
        ResourceFactory<F, String> pair = errorAware().map2(failingOnRelease("r0"), failingOnRelease("r1"),
            (left, right) -> left.name() + "+" + right.name());

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r0", releaseFailure.getResourceName());
        assertReleasedOnce("r0");
        assertReleasedOnce("r1");
    }

    @Test
    void testMap2_ErrorAware_CombinerThrows_BothReleased() {
        // Given
        ResourceFactory<F, String> pair = errorAware().map2(exclusive("r0"), exclusive("r1"), (left, right) -> {
            throw BOOM;
        });

        // When
        Throwable failure = awaitFailure(errorAware().run(pair));

        // Then
        assertSame(BOOM, failure);
        assertReleasedOnce("r0");
        assertReleasedOnce("r1");
        assertNoLeak();
    }

    @Test
    void testAp_ErrorAware_FunctionFactoryFails_ArgumentReleased() {
        // Given
        ResourceFactory<F, Function<? super FakeResource, ? extends String>> describe =
            errorAware().raiseError(BOOM);

        // When
        Throwable failure = awaitFailure(errorAware().run(errorAware().ap(exclusive("arg"), describe)));

        // Then
        assertSame(BOOM, failure);
        assertEvents("acquire arg", "release arg");
        assertNoLeak();
    }
}
