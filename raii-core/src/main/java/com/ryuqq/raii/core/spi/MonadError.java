package com.ryuqq.raii.core.spi;

import com.ryuqq.raii.core.outcome.Attempt;

import java.util.function.Function;

/**
 * Host effect capability: a native error channel.
 *
 * <p>{@code S} is whatever the host uses for failures, usually {@link Throwable}. The
 * resource core never creates an {@code S} itself; it only catches and re-raises the
 * ones the host produced.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #handleError(Effect, Function)} only intercepts failures of {@code fa},
 *       not failures of the handler's result</li>
 *   <li>Exceptions thrown by suppliers and functions given to this capability should end
 *       up in the error channel when {@code S} can represent them</li>
 * </ul>
 *
 * @param <F> witness type of the host effect
 * @param <S> error type of the host effect
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MonadError<F, S> extends Monad<F> {

    /**
     * Creates a computation that fails with {@code error}.
     *
     * @param error the error to raise
     * @param <A> nominal result type
     * @return failing computation
     */
    <A> Effect<F, A> raiseError(S error);

    /**
     * Recovers from a failure of {@code fa} with a replacement computation.
     *
     * @param fa computation that may fail
     * @param handler replacement computation per error
     * @param <A> result type
     * @return recovered computation
     */
    <A> Effect<F, A> handleError(Effect<F, A> fa, Function<? super S, ? extends Effect<F, A>> handler);

    /**
     * Moves the outcome of {@code fa} into the value channel.
     *
     * <p>The returned computation never fails through the error channel.</p>
     *
     * @param fa computation that may fail
     * @param <A> result type
     * @return computation of the captured outcome
     */
    default <A> Effect<F, Attempt<S, A>> attempt(Effect<F, A> fa) {
        return handleError(map(fa, Attempt::<S, A>succeeded), s -> point(() -> Attempt.<S, A>failed(s)));
    }
}
