package com.ryuqq.raii.core.spi;

import java.util.List;

/**
 * Host effect capability: racing a non-empty set of computations.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>All computations are started; the first to complete decides the result</li>
 *   <li>Losing computations are not cancelled; they are handed back as residuals</li>
 *   <li>A residual must not restart its computation: it refers to the one the race started.
 *       Whether running a residual twice replays the same result is up to the host and
 *       must be documented by the adapter</li>
 * </ul>
 *
 * @param <F> witness type of the host effect
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Nondeterminism<F> extends Monad<F> {

    /**
     * Races {@code head} and {@code tail}.
     *
     * @param head first computation (guarantees non-emptiness)
     * @param tail remaining computations, may be empty
     * @param <A> result type
     * @return computation of the winner and the residuals
     */
    <A> Effect<F, RaceResult<F, A>> chooseAny(Effect<F, A> head, List<Effect<F, A>> tail);
}
