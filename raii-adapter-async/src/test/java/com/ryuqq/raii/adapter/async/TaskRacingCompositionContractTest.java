package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.core.spi.Nondeterminism;
import com.ryuqq.raii.testkit.contract.EffectHarness;
import com.ryuqq.raii.testkit.contract.RacingCompositionContract;

/**
 * Racing composition contract for the asynchronous adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskRacingCompositionContractTest extends RacingCompositionContract<Task.Witness> {

    private TaskHarness taskHarness;

    @Override
    protected EffectHarness<Task.Witness> createHarness() {
        taskHarness = new TaskHarness();
        return taskHarness;
    }

    @Override
    protected Nondeterminism<Task.Witness> nondeterminism() {
        return taskHarness.effects();
    }
}
