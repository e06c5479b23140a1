package com.ryuqq.raii.core.outcome;

import java.util.function.Function;

/**
 * 호스트 effect 실행 결과를 값으로 옮긴 것.
 *
 * <p>Attempt는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 값과 함께 성공</li>
 *   <li>{@link Failed}: 호스트 에러 채널의 에러와 함께 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.
 * 에러 인식 합성(error-aware composition)은 inner release 결과를 Attempt로 붙잡아 둔 뒤
 * outer release를 무조건 실행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * String text = attempt.fold(
 *     error -&gt; "Failed: " + error,
 *     value -&gt; "Success: " + value
 * );
 * </pre>
 *
 * @param <S> 에러 타입
 * @param <A> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Attempt<S, A> permits Succeeded, Failed {

    /**
     * 성공 결과 생성.
     *
     * @param value 값 (null 허용)
     * @param <S> 에러 타입
     * @param <A> 값 타입
     * @return Succeeded 인스턴스
     */
    static <S, A> Attempt<S, A> succeeded(A value) {
        return new Succeeded<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 에러
     * @param <S> 에러 타입
     * @param <A> 값 타입
     * @return Failed 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <S, A> Attempt<S, A> failed(S error) {
        return new Failed<>(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 두 경우를 하나의 값으로 접기.
     *
     * @param onFailure 실패 시 적용할 함수
     * @param onSuccess 성공 시 적용할 함수
     * @param <R> 결과 타입
     * @return 적용 결과
     */
    default <R> R fold(Function<? super S, ? extends R> onFailure, Function<? super A, ? extends R> onSuccess) {
        if (this instanceof Succeeded<S, A> succeeded) {
            return onSuccess.apply(succeeded.value());
        }
        return onFailure.apply(((Failed<S, A>) this).error());
    }
}
