package com.ryuqq.raii.adapter.async;

import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.MonadError;
import com.ryuqq.raii.core.spi.Nondeterminism;
import com.ryuqq.raii.core.spi.RaceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link Task} 호스트 effect 구현 ({@link MonadError} + {@link Nondeterminism}).
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>point(): 주입된 {@link Executor}에서 공급자 실행</li>
 *   <li>flatMap(): 앞 단계 완료 후 다음 Task 시작</li>
 *   <li>map2(): 두 Task를 모두 시작한 뒤 결합 (Executor가 허용하면 병렬), 둘 다 끝나야 완료</li>
 *   <li>handleError(): {@link CompletionException}/{@link ExecutionException}을 벗겨 원래 예외를 핸들러에 전달</li>
 *   <li>chooseAny(): 모든 Task를 시작하고 가장 먼저 끝난 결과(값 또는 실패)로 완료</li>
 * </ul>
 *
 * <p><strong>Residual 정책 (replay):</strong> 경주에서 진 Task는 경주가 시작한 future를 그대로
 * 가리킵니다. residual을 여러 번 실행하면 매번 같은 결과(같은 Handle)를 다시 관찰하므로,
 * residual 하나는 한 번만 획득·반납해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskEffects implements MonadError<Task.Witness, Throwable>, Nondeterminism<Task.Witness> {

    private static final Logger log = LoggerFactory.getLogger(TaskEffects.class);

    private final Executor executor;

    /**
     * 생성자.
     *
     * @param executor point() 공급자를 실행할 Executor
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public TaskEffects(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    @Override
    public <A> Effect<Task.Witness, A> point(Supplier<? extends A> value) {
        return Task.fromFuture(() -> CompletableFuture.<A>supplyAsync(value::get, executor));
    }

    @Override
    public <A, B> Effect<Task.Witness, B> flatMap(Effect<Task.Witness, A> fa,
                                                 Function<? super A, ? extends Effect<Task.Witness, B>> f) {
        Task<A> source = Task.narrow(fa);
        return Task.fromFuture(() -> source.unsafeToFuture()
            .thenCompose(a -> Task.narrow(f.apply(a)).unsafeToFuture()));
    }

    @Override
    public <A, B, C> Effect<Task.Witness, C> map2(Effect<Task.Witness, A> fa, Effect<Task.Witness, B> fb,
                                                 BiFunction<? super A, ? super B, ? extends C> f) {
        Task<A> left = Task.narrow(fa);
        Task<B> right = Task.narrow(fb);
        return Task.fromFuture(() -> {
            CompletableFuture<A> leftFuture = left.unsafeToFuture();
            CompletableFuture<B> rightFuture = right.unsafeToFuture();
            return leftFuture.thenCombine(rightFuture, f);
        });
    }

    @Override
    public <A> Effect<Task.Witness, A> raiseError(Throwable error) {
        return Task.failed(error);
    }

    @Override
    public <A> Effect<Task.Witness, A> handleError(Effect<Task.Witness, A> fa,
                                                  Function<? super Throwable, ? extends Effect<Task.Witness, A>> handler) {
        Task<A> source = Task.narrow(fa);
        return Task.fromFuture(() -> source.unsafeToFuture()
            .exceptionallyCompose(error -> Task.narrow(handler.apply(unwrap(error))).unsafeToFuture()));
    }

    @Override
    public <A> Effect<Task.Witness, RaceResult<Task.Witness, A>> chooseAny(Effect<Task.Witness, A> head,
                                                                          List<Effect<Task.Witness, A>> tail) {
        if (head == null) {
            throw new IllegalArgumentException("head cannot be null");
        }
        if (tail == null) {
            throw new IllegalArgumentException("tail cannot be null");
        }
        List<Task<A>> contenders = new ArrayList<>(tail.size() + 1);
        contenders.add(Task.narrow(head));
        for (Effect<Task.Witness, A> effect : tail) {
            contenders.add(Task.narrow(effect));
        }
        return Task.fromFuture(() -> race(contenders));
    }

    /**
     * {@link CompletableFuture}가 씌운 래퍼 예외 벗기기.
     *
     * @param error 실패 원인
     * @return 원래 예외
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private <A> CompletableFuture<RaceResult<Task.Witness, A>> race(List<Task<A>> contenders) {
        List<CompletableFuture<A>> started = new ArrayList<>(contenders.size());
        for (Task<A> contender : contenders) {
            started.add(contender.unsafeToFuture());
        }

        CompletableFuture<RaceResult<Task.Witness, A>> result = new CompletableFuture<>();
        for (int i = 0; i < started.size(); i++) {
            int index = i;
            started.get(i).whenComplete((value, error) -> {
                if (result.isDone()) {
                    return;
                }
                if (error != null) {
                    if (result.completeExceptionally(unwrap(error))) {
                        log.debug("Race failed by branch {} of {}", index, started.size());
                    }
                    return;
                }
                if (result.complete(new RaceResult<>(value, residualsExcept(started, index)))) {
                    log.debug("Race won by branch {} of {}", index, started.size());
                }
            });
        }
        return result;
    }

    private static <A> List<Effect<Task.Witness, A>> residualsExcept(List<CompletableFuture<A>> started, int winner) {
        List<Effect<Task.Witness, A>> residuals = new ArrayList<>(started.size() - 1);
        for (int i = 0; i < started.size(); i++) {
            if (i != winner) {
                residuals.add(Task.replay(started.get(i)));
            }
        }
        return residuals;
    }
}
