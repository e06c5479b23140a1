package com.ryuqq.raii.core.spi;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Host effect capability: immediate success and independent combination.
 *
 * <p>This is the smallest capability a host effect must provide for resource factories
 * to be built on top of it. It is enough for pure, lifted and managed factories and for
 * independent composition.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #point(Supplier)} defers the supplier: it is evaluated when the computation
 *       runs, once per run, never memoized</li>
 *   <li>{@link #map2(Effect, Effect, BiFunction)} may evaluate both sides concurrently;
 *       callers must not rely on any ordering between them</li>
 *   <li>Thread-safe: one instance is shared by every factory built on it</li>
 * </ul>
 *
 * @param <F> witness type of the host effect
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Applicative<F> {

    /**
     * Creates a computation that succeeds with the supplied value.
     *
     * @param value deferred value, evaluated each time the computation runs
     * @param <A> value type
     * @return computation succeeding with the supplier's result
     */
    <A> Effect<F, A> point(Supplier<? extends A> value);

    /**
     * Transforms the result of a computation.
     *
     * @param fa source computation
     * @param f mapping function
     * @param <A> source type
     * @param <B> result type
     * @return mapped computation
     */
    <A, B> Effect<F, B> map(Effect<F, A> fa, Function<? super A, ? extends B> f);

    /**
     * Combines two independent computations.
     *
     * @param fa first computation
     * @param fb second computation
     * @param f combining function
     * @param <A> first result type
     * @param <B> second result type
     * @param <C> combined type
     * @return computation of the combined result
     */
    <A, B, C> Effect<F, C> map2(Effect<F, A> fa, Effect<F, B> fb,
                                BiFunction<? super A, ? super B, ? extends C> f);

    /**
     * Computation that succeeds with {@link Unit#INSTANCE}.
     *
     * @return unit computation
     */
    default Effect<F, Unit> unit() {
        return point(() -> Unit.INSTANCE);
    }
}
