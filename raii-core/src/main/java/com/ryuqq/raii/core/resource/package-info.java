/**
 * 자원 수명 기본 요소 패키지.
 *
 * <h2>포함 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.raii.core.resource.Handle} - 획득된 자원 (값 + release)</li>
 *   <li>{@link com.ryuqq.raii.core.resource.ResourceFactory} - Handle을 만드는 지연된 기술</li>
 * </ul>
 *
 * <h2>수명 주기</h2>
 * <p>Handle은 acquire 호출 안에서만 생성되고, 합성 연산의 후속 계산이 소비하며,
 * 그것을 도입한 가장 안쪽 run/using 또는 bind/ap 체인의 합성 release로 반납됩니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.core.resource;
