/**
 * Asynchronous host effect adapter.
 *
 * <p>This package provides {@link com.ryuqq.raii.adapter.async.Task}, a lazy computation backed
 * by {@link java.util.concurrent.CompletableFuture}, its host-effect instance
 * {@link com.ryuqq.raii.adapter.async.TaskEffects}, and
 * {@link com.ryuqq.raii.adapter.async.TaskRuntime}, which owns the worker pool.</p>
 *
 * <h2>Characteristics</h2>
 * <ul>
 *   <li><strong>Independent combination:</strong> both sides are started before combining and may run in parallel</li>
 *   <li><strong>Error channel:</strong> {@link java.lang.Throwable}, unwrapped from {@link java.util.concurrent.CompletionException}</li>
 *   <li><strong>Racing:</strong> first completion wins; losers keep running and are returned as replaying residuals</li>
 *   <li><strong>Cancellation:</strong> none</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.adapter.async;
