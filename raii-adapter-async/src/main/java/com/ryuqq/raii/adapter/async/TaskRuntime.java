package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.core.composition.ResourceFactories;
import com.ryuqq.raii.core.composition.ResourceFactoryMonadError;
import com.ryuqq.raii.core.composition.ResourceFactoryNondeterminism;
import com.ryuqq.raii.core.spi.Effect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Task 실행 런타임.
 *
 * <p>고정 크기 스레드 풀을 소유하고, 그 위에서 동작하는 {@link TaskEffects}와
 * ResourceFactory 합성 인스턴스를 제공합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>{@link TaskRuntimeConfig}에 따른 워커 스레드 풀 생성 (데몬 스레드)</li>
 *   <li>에러 인식 합성({@link #factories()})과 경쟁 합성({@link #racing()}) 인스턴스 제공</li>
 *   <li>블로킹 호출자를 위한 {@link #await(Effect, long)}</li>
 *   <li>close() 시 진행 중 작업 대기 후 종료</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (TaskRuntime runtime = new TaskRuntime(new TaskRuntimeConfig().withParallelism(4))) {
 *     ResourceFactoryMonadError&lt;Task.Witness, Throwable&gt; factories = runtime.factories();
 *     Connection connection = runtime.await(factories.run(connectionFactory), 1000);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskRuntime.class);

    private final TaskRuntimeConfig config;
    private final ExecutorService executorService;
    private final TaskEffects effects;
    private final ResourceFactoryMonadError<Task.Witness, Throwable> factories;
    private final ResourceFactoryNondeterminism<Task.Witness> racing;

    /**
     * 기본 설정 생성자.
     */
    public TaskRuntime() {
        this(new TaskRuntimeConfig());
    }

    /**
     * 생성자.
     *
     * @param config 런타임 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public TaskRuntime(TaskRuntimeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.executorService = Executors.newFixedThreadPool(
            config.parallelism(), daemonThreadFactory(config.threadNamePrefix()));
        this.effects = new TaskEffects(executorService);
        this.factories = ResourceFactories.monadError(effects);
        this.racing = ResourceFactories.nondeterminism(effects);
        log.info("TaskRuntime started: parallelism={}, threadNamePrefix={}",
            config.parallelism(), config.threadNamePrefix());
    }

    /**
     * 호스트 effect 조회.
     *
     * @return 이 런타임의 스레드 풀 위에서 동작하는 TaskEffects
     */
    public TaskEffects effects() {
        return effects;
    }

    /**
     * 에러 인식 합성 인스턴스.
     *
     * @return ResourceFactoryMonadError
     */
    public ResourceFactoryMonadError<Task.Witness, Throwable> factories() {
        return factories;
    }

    /**
     * 경쟁 합성 인스턴스.
     *
     * @return ResourceFactoryNondeterminism
     */
    public ResourceFactoryNondeterminism<Task.Witness> racing() {
        return racing;
    }

    /**
     * 설정 조회.
     *
     * @return 런타임 설정
     */
    public TaskRuntimeConfig config() {
        return config;
    }

    /**
     * Task를 시작하고 결과를 기다림.
     *
     * <p>실패 시 원래 예외를 던집니다. unchecked 예외와 {@link Error}는 그대로,
     * checked 예외는 {@link CompletionException}으로 감쌉니다.</p>
     *
     * @param effect 실행할 Task
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @param <A> 결과 타입
     * @return 결과
     * @throws IllegalStateException 시간 초과 또는 대기 중 인터럽트 발생 시
     */
    public <A> A await(Effect<Task.Witness, A> effect, long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        try {
            return Task.narrow(effect).unsafeToFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting task", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Task did not complete within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = TaskEffects.unwrap(e);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    /**
     * 스레드 풀 종료.
     *
     * <p>shutdownTimeoutMs 동안 진행 중 작업을 기다린 뒤, 남은 작업이 있으면 강제 종료합니다.</p>
     */
    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("TaskRuntime did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        log.info("TaskRuntime stopped");
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
