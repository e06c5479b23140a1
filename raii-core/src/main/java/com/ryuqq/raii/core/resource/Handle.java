package com.ryuqq.raii.core.resource;

import com.ryuqq.raii.core.spi.Applicative;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.Unit;

import java.util.function.Supplier;

/**
 * 획득된 자원: 값과 그 자원을 반납하는 release 동작.
 *
 * <p>Handle은 {@link ResourceFactory#acquire()} 안에서만 만들어지며,
 * 현재 Handle을 들고 있는 합성(composition)이 단독으로 소유합니다.
 * bind/ap 체인을 거치면 소유권은 새 합성 Handle로 넘어갑니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>코어가 만든 Handle의 {@link #release()}는 최대 한 번만 실행됩니다</li>
 *   <li>release 이후 {@link #value()}가 관리 자원(예: managed {@link AutoCloseable})이라면 사용하면 안 됩니다</li>
 * </ul>
 *
 * @param <F> 호스트 effect witness 타입
 * @param <A> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Handle<F, A> {

    /**
     * 자원 값 조회.
     *
     * @return 자원 값
     */
    A value();

    /**
     * 이 Handle이 획득한 모든 자원을 반납하는 계산 생성.
     *
     * <p>호출 자체는 계산을 만들 뿐이며, 실제 반납은 호스트 effect가 계산을 실행할 때 일어납니다.</p>
     *
     * @return release 계산
     */
    Effect<F, Unit> release();

    /**
     * 값과 release 계산 공급자로 Handle 생성.
     *
     * @param value 자원 값
     * @param release release 계산 공급자 ({@link #release()} 호출마다 평가)
     * @param <F> 호스트 effect witness 타입
     * @param <A> 값 타입
     * @return Handle 인스턴스
     * @throws IllegalArgumentException release가 null인 경우
     */
    static <F, A> Handle<F, A> of(A value, Supplier<? extends Effect<F, Unit>> release) {
        return new DefaultHandle<>(value, release);
    }

    /**
     * release가 아무 일도 하지 않는 Handle 생성.
     *
     * @param applicative 호스트 effect
     * @param value 자원 값
     * @param <F> 호스트 effect witness 타입
     * @param <A> 값 타입
     * @return no-op release Handle
     */
    static <F, A> Handle<F, A> unreleasable(Applicative<F> applicative, A value) {
        return new DefaultHandle<>(value, applicative::unit);
    }
}
