/**
 * Synchronous host effect adapter.
 *
 * <p>This package provides {@link com.ryuqq.raii.adapter.sync.SyncIO}, a lazy computation
 * that runs on the calling thread, and its {@link com.ryuqq.raii.core.spi.MonadError}
 * instance {@link com.ryuqq.raii.adapter.sync.SyncIOEffects}.</p>
 *
 * <h2>Characteristics</h2>
 * <ul>
 *   <li><strong>Ordering:</strong> independent combination runs the left side first</li>
 *   <li><strong>Error channel:</strong> {@link java.lang.Throwable}; unchecked exceptions from user code are captured</li>
 *   <li><strong>Racing:</strong> not supported (no {@link com.ryuqq.raii.core.spi.Nondeterminism} instance)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.adapter.sync;
