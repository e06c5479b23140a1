package com.ryuqq.raii.adapter.sync;

import com.ryuqq.raii.testkit.contract.EffectHarness;
import com.ryuqq.raii.testkit.contract.IndependentCompositionContract;

/**
 * Independent composition contract for the synchronous adapter (map2 runs left first).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SyncIOIndependentCompositionContractTest extends IndependentCompositionContract<SyncIO.Witness> {

    @Override
    protected EffectHarness<SyncIO.Witness> createHarness() {
        return new SyncIOHarness();
    }
}
