/**
 * ResourceFactory 합성 연산 패키지.
 *
 * <p>각 인스턴스는 생성 시 호스트 effect capability를 명시적으로 주입받습니다.
 * capability 계층을 그대로 따라 상속합니다.</p>
 *
 * <h2>인스턴스 계층</h2>
 * <pre>
 * ResourceFactoryApplicative      pure / point / liftEffect / managed / map / ap / map2
 *   └─ ResourceFactoryMonad       flatMap (LIFO release) / flatten / run / using
 *        ├─ ResourceFactoryMonadError     raiseError / handleError / attempt / 에러 인식 flatMap
 *        └─ ResourceFactoryNondeterminism chooseAny
 * </pre>
 *
 * <h2>반납 순서 보장</h2>
 * <ul>
 *   <li><strong>순차 합성:</strong> 획득의 역순으로 결정적 반납</li>
 *   <li><strong>독립 합성 / 경쟁 합성:</strong> 형제 사이 순서 보장 없음, 호스트가 허용하면 병렬</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.raii.core.composition;
