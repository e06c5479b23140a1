package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.core.spi.Effect;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Lazy asynchronous computation backed by {@link CompletableFuture}.
 *
 * <p>A Task is a recipe: each call to {@link #unsafeToFuture()} starts it again and returns a
 * fresh future. The only exception is a task made by {@link #replay(CompletableFuture)}, which
 * refers to a computation that has already been started (for example a losing branch of a
 * race) and hands out a copy of that same future on every start.</p>
 *
 * <p><strong>Bridging:</strong></p>
 * <ul>
 *   <li>{@link #fromFuture(Supplier)}: wrap any future-returning call</li>
 *   <li>{@link #unsafeToFuture()} / {@link #toCompletionStage()}: start the task and hand the
 *       result to code that speaks {@link CompletableFuture} or {@link CompletionStage}</li>
 * </ul>
 *
 * @param <A> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Task<A> implements Effect<Task.Witness, A> {

    /**
     * Witness type tagging {@link Effect}s produced by this adapter.
     */
    public static final class Witness {
        private Witness() {
        }
    }

    private final Supplier<? extends CompletableFuture<A>> start;

    private Task(Supplier<? extends CompletableFuture<A>> start) {
        this.start = start;
    }

    /**
     * Creates a task that calls {@code start} every time it is run.
     *
     * @param start future producer
     * @param <A> result type
     * @return lazy task
     * @throws IllegalArgumentException if start is null
     */
    public static <A> Task<A> fromFuture(Supplier<? extends CompletableFuture<A>> start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        return new Task<>(start);
    }

    /**
     * Creates a task that fails with {@code error}.
     *
     * @param error the failure
     * @param <A> nominal result type
     * @return failing task
     * @throws IllegalArgumentException if error is null
     */
    public static <A> Task<A> failed(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Task<>(() -> CompletableFuture.failedFuture(error));
    }

    /**
     * Creates a task over a computation that is already running.
     *
     * <p>Running the task does not restart anything: every run observes the same outcome
     * through its own copy of {@code future}.</p>
     *
     * @param future the pending computation
     * @param <A> result type
     * @return replaying task
     */
    static <A> Task<A> replay(CompletableFuture<A> future) {
        return new Task<>(future::copy);
    }

    /**
     * Narrows a core {@link Effect} back to {@link Task}.
     *
     * @param effect computation created by {@link TaskEffects}
     * @param <A> result type
     * @return the same computation
     * @throws IllegalArgumentException if the computation belongs to another adapter
     */
    public static <A> Task<A> narrow(Effect<Witness, A> effect) {
        if (effect instanceof Task<A> computation) {
            return computation;
        }
        throw new IllegalArgumentException("Not a Task computation: " + effect);
    }

    /**
     * Starts the task.
     *
     * <p>An unchecked exception thrown while starting becomes a failed future.</p>
     *
     * @return future of the result
     */
    public CompletableFuture<A> unsafeToFuture() {
        try {
            return start.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Starts the task.
     *
     * @return completion stage of the result
     */
    public CompletionStage<A> toCompletionStage() {
        return unsafeToFuture();
    }

    @Override
    public String toString() {
        return "Task@" + Integer.toHexString(System.identityHashCode(this));
    }
}
