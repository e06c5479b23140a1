/**
 * 호스트 effect 실행 결과를 값으로 표현하는 타입 패키지.
 *
 * <h2>포함 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.raii.core.outcome.Attempt} - sealed 결과 타입</li>
 *   <li>{@link com.ryuqq.raii.core.outcome.Succeeded} - 성공</li>
 *   <li>{@link com.ryuqq.raii.core.outcome.Failed} - 실패</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.core.outcome;
