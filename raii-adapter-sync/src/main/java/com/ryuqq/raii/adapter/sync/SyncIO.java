package com.ryuqq.raii.adapter.sync;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.outcome.Failed;
import com.ryuqq.raii.core.outcome.Succeeded;
import com.ryuqq.raii.core.spi.Effect;

import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Lazy synchronous computation.
 *
 * <p>Nothing runs until {@link #unsafeRun()} or {@link #unsafeRunAttempt()} is called, and
 * every call runs the whole computation again on the calling thread. Unchecked exceptions
 * thrown by user code are captured into the error channel; {@link Error}s are not.</p>
 *
 * <p><strong>Stack depth:</strong> evaluation is not trampolined. Every {@code flatMap} or
 * {@code handleError} layer built by {@link SyncIOEffects} runs its source through a nested
 * {@link #unsafeRunAttempt()} call, so the stack grows with the number of chained layers.
 * Chains of about a thousand layers run on a default thread stack; much deeper chains end in a
 * {@link StackOverflowError}, which is an {@link Error} and is not captured. Composing many
 * factories in one run, e.g. folding a long list with {@code flatMap}, is the usual way to get there.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * SyncIO&lt;Integer&gt; io = SyncIO.delay(() -&gt; 1 + 1);
 * int two = io.unsafeRun();
 * </pre>
 *
 * @param <A> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SyncIO<A> implements Effect<SyncIO.Witness, A> {

    /**
     * Witness type tagging {@link Effect}s produced by this adapter.
     */
    public static final class Witness {
        private Witness() {
        }
    }

    private final Supplier<Attempt<Throwable, A>> thunk;

    private SyncIO(Supplier<Attempt<Throwable, A>> thunk) {
        this.thunk = thunk;
    }

    /**
     * Creates a computation that evaluates {@code supplier} on every run.
     *
     * @param supplier deferred value
     * @param <A> result type
     * @return lazy computation
     * @throws IllegalArgumentException if supplier is null
     */
    public static <A> SyncIO<A> delay(Supplier<? extends A> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier cannot be null");
        }
        return new SyncIO<>(() -> {
            try {
                return Attempt.succeeded(supplier.get());
            } catch (RuntimeException e) {
                return Attempt.failed(e);
            }
        });
    }

    /**
     * Creates a computation that fails with {@code error}.
     *
     * @param error the failure
     * @param <A> nominal result type
     * @return failing computation
     * @throws IllegalArgumentException if error is null
     */
    public static <A> SyncIO<A> failed(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new SyncIO<>(() -> Attempt.failed(error));
    }

    /**
     * Creates a computation from a thunk producing an outcome.
     *
     * <p>Unchecked exceptions escaping the thunk are captured as failures.</p>
     *
     * @param thunk outcome producer
     * @param <A> result type
     * @return lazy computation
     */
    static <A> SyncIO<A> suspend(Supplier<Attempt<Throwable, A>> thunk) {
        return new SyncIO<>(() -> {
            try {
                return thunk.get();
            } catch (RuntimeException e) {
                return Attempt.failed(e);
            }
        });
    }

    /**
     * Narrows a core {@link Effect} back to {@link SyncIO}.
     *
     * @param effect computation created by {@link SyncIOEffects}
     * @param <A> result type
     * @return the same computation
     * @throws IllegalArgumentException if the computation belongs to another adapter
     */
    public static <A> SyncIO<A> narrow(Effect<Witness, A> effect) {
        if (effect instanceof SyncIO<A> computation) {
            return computation;
        }
        throw new IllegalArgumentException("Not a SyncIO computation: " + effect);
    }

    /**
     * Runs the computation and captures its outcome.
     *
     * @return the outcome, never throwing for failures in the error channel
     */
    public Attempt<Throwable, A> unsafeRunAttempt() {
        return thunk.get();
    }

    /**
     * Runs the computation.
     *
     * <p>Unchecked failures are rethrown as-is; checked failures are wrapped in
     * {@link CompletionException}.</p>
     *
     * @return the result
     */
    public A unsafeRun() {
        Attempt<Throwable, A> outcome = unsafeRunAttempt();
        if (outcome instanceof Succeeded<Throwable, A> succeeded) {
            return succeeded.value();
        }
        Throwable error = ((Failed<Throwable, A>) outcome).error();
        if (error instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        throw new CompletionException(error);
    }

    @Override
    public String toString() {
        return "SyncIO@" + Integer.toHexString(System.identityHashCode(this));
    }
}
