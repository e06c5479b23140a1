package com.ryuqq.raii.core.spi;

import java.util.List;

/**
 * Result of {@link Nondeterminism#chooseAny(Effect, List)}.
 *
 * @param winner result of the first computation to complete
 * @param residuals the other computations, still pending or already finished, in their
 *                  original order without the winner
 * @param <F> witness type of the host effect
 * @param <A> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RaceResult<F, A>(A winner, List<Effect<F, A>> residuals) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException residuals가 null인 경우
     */
    public RaceResult {
        if (residuals == null) {
            throw new IllegalArgumentException("residuals cannot be null");
        }
        residuals = List.copyOf(residuals);
    }
}
