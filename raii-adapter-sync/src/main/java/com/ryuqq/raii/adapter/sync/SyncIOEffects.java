package com.ryuqq.raii.adapter.sync;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.outcome.Failed;
import com.ryuqq.raii.core.outcome.Succeeded;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.MonadError;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link MonadError} 구현 ({@link SyncIO}, 에러 타입 {@link Throwable}).
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>point(): 실행할 때마다 공급자 평가, 예외는 에러 채널로</li>
 *   <li>flatMap(): 호출 스레드에서 순서대로 실행</li>
 *   <li>map2(): 왼쪽 먼저, 그다음 오른쪽 (병렬 없음)</li>
 *   <li>handleError(): 원본 실패 시 대체 계산 실행</li>
 * </ul>
 *
 * <p>상태가 없으므로 싱글톤으로 공유합니다.</p>
 *
 * <p>flatMap/handleError는 중첩 실행이므로 합성 깊이만큼 스택을 사용합니다.
 * 깊이 제한은 {@link SyncIO} 문서를 참고하세요.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SyncIOEffects implements MonadError<SyncIO.Witness, Throwable> {
    INSTANCE;

    @Override
    public <A> Effect<SyncIO.Witness, A> point(Supplier<? extends A> value) {
        return SyncIO.delay(value);
    }

    @Override
    public <A, B> Effect<SyncIO.Witness, B> flatMap(Effect<SyncIO.Witness, A> fa,
                                                   Function<? super A, ? extends Effect<SyncIO.Witness, B>> f) {
        SyncIO<A> source = SyncIO.narrow(fa);
        return SyncIO.suspend(() -> {
            Attempt<Throwable, A> outcome = source.unsafeRunAttempt();
            if (outcome instanceof Succeeded<Throwable, A> succeeded) {
                return SyncIO.narrow(f.apply(succeeded.value())).unsafeRunAttempt();
            }
            return Attempt.failed(((Failed<Throwable, A>) outcome).error());
        });
    }

    @Override
    public <A, B, C> Effect<SyncIO.Witness, C> map2(Effect<SyncIO.Witness, A> fa, Effect<SyncIO.Witness, B> fb,
                                                   BiFunction<? super A, ? super B, ? extends C> f) {
        return flatMap(fa, a -> map(fb, b -> f.apply(a, b)));
    }

    @Override
    public <A> Effect<SyncIO.Witness, A> raiseError(Throwable error) {
        return SyncIO.failed(error);
    }

    @Override
    public <A> Effect<SyncIO.Witness, A> handleError(Effect<SyncIO.Witness, A> fa,
                                                    Function<? super Throwable, ? extends Effect<SyncIO.Witness, A>> handler) {
        SyncIO<A> source = SyncIO.narrow(fa);
        return SyncIO.suspend(() -> {
            Attempt<Throwable, A> outcome = source.unsafeRunAttempt();
            if (outcome instanceof Failed<Throwable, A> failed) {
                return SyncIO.narrow(handler.apply(failed.error())).unsafeRunAttempt();
            }
            return outcome;
        });
    }
}
