/**
 * Abstract contract tests for host effect adapters.
 *
 * <p>Every adapter extends the contracts that match its capabilities and provides an
 * {@link com.ryuqq.raii.testkit.contract.EffectHarness}. Hosts without a racing primitive skip
 * {@link com.ryuqq.raii.testkit.contract.RacingCompositionContract}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.testkit.contract;
