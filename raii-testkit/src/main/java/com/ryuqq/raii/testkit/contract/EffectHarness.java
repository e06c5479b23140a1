package com.ryuqq.raii.testkit.contract;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.MonadError;

/**
 * Contract 테스트가 호스트 effect를 다루기 위한 어댑터별 진입점.
 *
 * <p>각 어댑터 테스트 모듈은 자신의 effect 인스턴스와 "실행 후 결과 대기" 방법을 이 인터페이스로
 * 제공합니다. 비동기 어댑터처럼 스레드 풀을 소유하는 경우 {@link #close()}에서 정리합니다.</p>
 *
 * @param <F> 호스트 effect witness 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EffectHarness<F> extends AutoCloseable {

    /**
     * 에러 채널이 Throwable인 호스트 effect 인스턴스.
     *
     * @return MonadError 인스턴스
     */
    MonadError<F, Throwable> effects();

    /**
     * effect를 실행하고 완료될 때까지 기다립니다 (블로킹).
     *
     * @param effect 실행할 effect
     * @param <A> 결과 타입
     * @return 성공 값 또는 실패 원인
     */
    <A> Attempt<Throwable, A> runAttempt(Effect<F, A> effect);

    @Override
    default void close() {
    }
}
