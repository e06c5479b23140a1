package com.ryuqq.raii.core.spi;

import java.util.function.Function;

/**
 * Host effect capability: sequencing of dependent steps.
 *
 * @param <F> witness type of the host effect
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Monad<F> extends Applicative<F> {

    /**
     * Runs {@code fa}, then the computation derived from its result.
     *
     * <p>If {@code fa} fails, {@code f} is never invoked.</p>
     *
     * @param fa first step
     * @param f continuation producing the second step
     * @param <A> first result type
     * @param <B> second result type
     * @return sequenced computation
     */
    <A, B> Effect<F, B> flatMap(Effect<F, A> fa, Function<? super A, ? extends Effect<F, B>> f);

    @Override
    default <A, B> Effect<F, B> map(Effect<F, A> fa, Function<? super A, ? extends B> f) {
        return flatMap(fa, a -> point(() -> f.apply(a)));
    }
}
