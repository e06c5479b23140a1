package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.testkit.contract.EffectHarness;
import com.ryuqq.raii.testkit.contract.SequentialCompositionContract;

/**
 * Sequential composition contract for the asynchronous adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskSequentialCompositionContractTest extends SequentialCompositionContract<Task.Witness> {

    @Override
    protected EffectHarness<Task.Witness> createHarness() {
        return new TaskHarness();
    }
}
