package com.ryuqq.raii.core.outcome;

/**
 * 실패 결과.
 *
 * <p>호스트 effect의 에러 채널에서 잡아 온 에러를 담습니다.
 * 코어는 에러를 만들지 않고 전달만 합니다.</p>
 *
 * @param error 에러 (null 불가)
 * @param <S> 에러 타입
 * @param <A> 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed<S, A>(S error) implements Attempt<S, A> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Failed {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
