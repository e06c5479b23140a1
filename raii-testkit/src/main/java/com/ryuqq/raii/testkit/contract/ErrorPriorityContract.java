package com.ryuqq.raii.testkit.contract;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.outcome.Failed;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.testkit.fixture.CannotOpenResourceTwiceException;
import com.ryuqq.raii.testkit.fixture.FakeResource;
import com.ryuqq.raii.testkit.fixture.RecordingResource;
import com.ryuqq.raii.testkit.fixture.ReleaseFailedException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: error-aware composition.
 *
 * <p>Validates that a resource already held is released when the rest of the chain fails, that
 * both releases of a chain are always attempted, and which error surfaces when several fail.</p>
 *
 * <p><strong>Error Priority:</strong></p>
 * <ul>
 *   <li>Continuation failure + outer release failure → release failure</li>
 *   <li>Inner release failure + outer release failure → outer release failure</li>
 *   <li>Inner release failure only → inner release failure</li>
 * </ul>
 *
 * @param <F> host effect witness type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ErrorPriorityContract<F> extends AbstractResourceContractTest<F> {

    private static final IllegalStateException BOOM = new IllegalStateException("boom");

    @Test
    void testRaiseError_ContinuationNeverInvoked_NothingReleased() {
        // Given
        AtomicBoolean invoked = new AtomicBoolean();
        ResourceFactory<F, RecordingResource> failed = errorAware().raiseError(BOOM);

        // When
        Throwable failure = awaitFailure(errorAware().run(errorAware().flatMap(failed, resource -> {
            invoked.set(true);
            return recording("never");
        })));

        // Then
        assertSame(BOOM, failure);
        assertFalse(invoked.get());
        assertTrue(events.events().isEmpty());
    }

    @Test
    void testContinuationThrows_HeldResourceReleasedOnce() {
        // Given
        ResourceFactory<F, String> chain = errorAware().<RecordingResource, String>flatMap(recording("r0"), resource -> {
            events.record("error is coming");
            throw BOOM;
        });

        // When
        Throwable failure = awaitFailure(errorAware().run(chain));

        // Then
        assertSame(BOOM, failure);
        assertEvents("acquire r0", "error is coming", "release r0");
    }

    @Test
    void testContinuationReturnsFailingFactory_HeldResourceReleasedOnce() {
        // Given
        ResourceFactory<F, String> chain = errorAware().flatMap(recording("r0"),
            resource -> errorAware().<String>raiseError(BOOM));

        // When
        Throwable failure = awaitFailure(errorAware().run(chain));

        // Then
        assertSame(BOOM, failure);
        assertEvents("acquire r0", "release r0");
    }

    @Test
    void testMapThrows_HeldResourceReleasedOnce() {
        // Given
        ResourceFactory<F, Integer> mapped = errorAware().<RecordingResource, Integer>map(recording("r0"), resource -> {
            throw BOOM;
        });

        // When
        Throwable failure = awaitFailure(errorAware().run(mapped));

        // Then
        assertSame(BOOM, failure);
        assertReleasedOnce("r0");
    }

    @Test
    void testExclusiveConflict_ErrorAware_OuterResourceReleased() {
        // Given
        ResourceFactory<F, FakeResource> r0 = exclusive("r0");
        ResourceFactory<F, FakeResource> twice = errorAware().flatMap(r0, first -> errorAware().map(r0, second -> second));

        // When
        Throwable failure = awaitFailure(errorAware().run(twice));

        // Then
        assertInstanceOf(CannotOpenResourceTwiceException.class, failure);
        assertEvents("acquire r0", "release r0");
        assertNoLeak();
    }

    @Test
    void testContinuationFails_AndOuterReleaseFails_ReleaseFailureWins() {
        // Given
        ResourceFactory<F, String> chain = errorAware().<RecordingResource, String>flatMap(failingOnRelease("r0"), resource -> {
            throw BOOM;
        });

        // When
        Throwable failure = awaitFailure(errorAware().run(chain));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r0", releaseFailure.getResourceName());
        assertReleasedOnce("r0");
    }

    @Test
    void testBothReleasesFail_OuterReleaseFailureWins_BothAttempted() {
        // Given
        ResourceFactory<F, String> chain = errorAware().flatMap(failingOnRelease("r0"), outer ->
            errorAware().map(failingOnRelease("r1"), inner -> outer.name() + inner.name()));

        // When
        Throwable failure = awaitFailure(errorAware().run(chain));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r0", releaseFailure.getResourceName());
        assertEvents("acquire r0", "acquire r1", "release r1", "release r0");
    }

    @Test
    void testOnlyInnerReleaseFails_InnerFailureSurfaces_OuterStillReleased() {
        // Given
        ResourceFactory<F, String> chain = errorAware().flatMap(recording("r0"), outer ->
            errorAware().map(failingOnRelease("r1"), inner -> outer.name() + inner.name()));

        // When
        Throwable failure = awaitFailure(errorAware().run(chain));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r1", releaseFailure.getResourceName());
        assertEvents("acquire r0", "acquire r1", "release r1", "release r0");
    }

    @Test
    void testOnlyOuterReleaseFails_OuterFailureSurfaces() {
        // Given
        ResourceFactory<F, String> chain = errorAware().flatMap(failingOnRelease("r0"), outer ->
            errorAware().map(recording("r1"), inner -> outer.name() + inner.name()));

        // When
        Throwable failure = awaitFailure(errorAware().run(chain));

        // Then
        ReleaseFailedException releaseFailure = assertInstanceOf(ReleaseFailedException.class, failure);
        assertEquals("r0", releaseFailure.getResourceName());
        assertEvents("acquire r0", "acquire r1", "release r1", "release r0");
    }

    @Test
    void testHandleError_AcquisitionFailure_ReplacementAcquiredAndReleased() {
        // Given
        ResourceFactory<F, RecordingResource> recovered = errorAware().handleError(
            errorAware().<RecordingResource>raiseError(BOOM),
            error -> recording("fallback"));

        // When
        RecordingResource result = awaitValue(errorAware().run(recovered));

        // Then
        assertEquals("fallback", result.name());
        assertEvents("acquire fallback", "release fallback");
    }

    @Test
    void testHandleError_DoesNotInterceptReleaseFailure() {
        // Given
        AtomicBoolean handlerInvoked = new AtomicBoolean();
        ResourceFactory<F, RecordingResource> guarded = errorAware().handleError(failingOnRelease("r0"), error -> {
            handlerInvoked.set(true);
            return recording("fallback");
        });

        // When
        Throwable failure = awaitFailure(errorAware().run(guarded));

        // Then
        assertInstanceOf(ReleaseFailedException.class, failure);
        assertFalse(handlerInvoked.get());
        assertEvents("acquire r0", "release r0");
    }

    @Test
    void testAttempt_AcquisitionFailure_CapturedAsValue() {
        // Given
        ResourceFactory<F, Attempt<Throwable, RecordingResource>> attempted =
            errorAware().attempt(errorAware().<RecordingResource>raiseError(BOOM));

        // When
        Attempt<Throwable, RecordingResource> result = awaitValue(errorAware().run(attempted));

        // Then
        Failed<Throwable, RecordingResource> failed = assertInstanceOf(Failed.class, result);
        assertSame(BOOM, failed.error());
    }

    @Test
    void testAttempt_Success_ResourceStillReleased() {
        // Given
        ResourceFactory<F, Attempt<Throwable, RecordingResource>> attempted = errorAware().attempt(recording("r0"));

        // When
        Attempt<Throwable, RecordingResource> result = awaitValue(errorAware().run(attempted));

        // Then
        assertTrue(result.isSucceeded());
        assertEvents("acquire r0", "release r0");
    }

    @Test
    void testUsing_ContinuationFails_ResourceReleasedAndErrorPropagated() {
        // Given
        ResourceFactory<F, RecordingResource> r0 = recording("r0");

        // When
        Throwable failure = awaitFailure(errorAware().using(r0,
            resource -> harness.effects().<String>raiseError(BOOM)));

        // Then
        assertSame(BOOM, failure);
        assertEvents("acquire r0", "release r0");
    }

    @Test
    void testUsing_ContinuationAndReleaseFail_ReleaseFailureWins() {
        // Given
        ResourceFactory<F, RecordingResource> r0 = failingOnRelease("r0");

        // When
        Throwable failure = awaitFailure(errorAware().using(r0,
            resource -> harness.effects().<String>raiseError(BOOM)));

        // Then
        assertInstanceOf(ReleaseFailedException.class, failure);
        assertReleasedOnce("r0");
    }
}
