package com.ryuqq.raii.adapter.sync;

import com.ryuqq.raii.testkit.contract.EffectHarness;
import com.ryuqq.raii.testkit.contract.SequentialCompositionContract;

/**
 * Sequential composition contract for the synchronous adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SyncIOSequentialCompositionContractTest extends SequentialCompositionContract<SyncIO.Witness> {

    @Override
    protected EffectHarness<SyncIO.Witness> createHarness() {
        return new SyncIOHarness();
    }
}
