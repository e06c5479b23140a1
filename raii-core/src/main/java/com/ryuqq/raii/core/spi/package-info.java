/**
 * Host effect Service Provider Interface (SPI) package.
 *
 * <p>This package defines the capabilities a host effect system must expose so that
 * resource factories can be composed on top of it. The core never schedules, blocks or
 * performs I/O; everything it does is expressed through these interfaces.</p>
 *
 * <h2>Capability Hierarchy</h2>
 * <ul>
 *   <li>{@link com.ryuqq.raii.core.spi.Applicative} - succeed immediately, independent combination</li>
 *   <li>{@link com.ryuqq.raii.core.spi.Monad} - sequencing of dependent steps</li>
 *   <li>{@link com.ryuqq.raii.core.spi.MonadError} - raise/handle on the host's error channel</li>
 *   <li>{@link com.ryuqq.raii.core.spi.Nondeterminism} - racing (optional)</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., raii-adapter-sync, raii-adapter-async) provide a concrete
 * computation type implementing {@link com.ryuqq.raii.core.spi.Effect} and an instance of
 * the capabilities it supports.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Explicit injection:</strong> capabilities are passed to the composition instance
 *       that needs them, never looked up</li>
 *   <li><strong>Dependency Inversion:</strong> core does not depend on any adapter</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.core.spi;
