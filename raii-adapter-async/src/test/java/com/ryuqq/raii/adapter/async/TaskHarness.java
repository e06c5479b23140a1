package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.testkit.contract.EffectHarness;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Task용 contract 테스트 harness (워커 4개짜리 TaskRuntime 소유).
 */
class TaskHarness implements EffectHarness<Task.Witness> {

    private static final long TIMEOUT_SECONDS = 10;

    private final TaskRuntime runtime = new TaskRuntime(
        new TaskRuntimeConfig().withParallelism(4).withThreadNamePrefix("contract-task-"));

    @Override
    public TaskEffects effects() {
        return runtime.effects();
    }

    @Override
    public <A> Attempt<Throwable, A> runAttempt(Effect<Task.Witness, A> effect) {
        try {
            return Task.narrow(effect).unsafeToFuture()
                .<Attempt<Throwable, A>>handle((value, error) -> error == null
                    ? Attempt.succeeded(value)
                    : Attempt.failed(TaskEffects.unwrap(error)))
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while awaiting task", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new AssertionError("Task did not settle", e);
        }
    }

    @Override
    public void close() {
        runtime.close();
    }
}
