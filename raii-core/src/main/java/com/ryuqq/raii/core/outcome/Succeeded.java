package com.ryuqq.raii.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 결과 값 (null 허용)
 * @param <S> 에러 타입
 * @param <A> 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Succeeded<S, A>(A value) implements Attempt<S, A> {
}
