package com.ryuqq.raii.core.resource;

import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.Monad;

import java.util.function.Function;

/**
 * {@link Handle}을 만드는 방법에 대한 지연된 기술(description).
 *
 * <p>ResourceFactory는 상태가 없는 재사용 가능한 기술이며 캐시된 싱글톤이 아닙니다.
 * 같은 팩토리를 두 번 획득하면 서로 독립적인 두 번의 획득이 일어납니다.
 * "두 번 열 수 없는 자원" 같은 배타성은 자원 자신이 강제하며,
 * 위반 시 일반적인 획득 실패로 드러납니다.</p>
 *
 * <p><strong>획득과 반납 흐름:</strong></p>
 * <pre>
 * acquire()  → Effect&lt;F, Handle&lt;F, A&gt;&gt;
 *   ↓ (합성 연산자들이 더 큰 팩토리를 구성)
 * run()/using()  → 실제로 획득과 반납이 실행되는 유일한 지점
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResourceFactory&lt;F, Connection&gt; connection = factories.managed(dataSource::getConnection);
 * Effect&lt;F, Integer&gt; rows = connection.using(monad, c -&gt; monad.point(() -&gt; count(c)));
 * </pre>
 *
 * @param <F> 호스트 effect witness 타입
 * @param <A> 자원 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceFactory<F, A> {

    /**
     * 자원 획득 계산 생성.
     *
     * <p>계산이 실패하면 Handle은 존재하지 않으므로 반납할 것도 없습니다.</p>
     *
     * @return Handle을 만드는 계산
     */
    Effect<F, Handle<F, A>> acquire();

    /**
     * 획득 후 즉시 반납하고 값만 돌려주는 계산 생성.
     *
     * <p>획득이 성공했다면 release는 항상 실행됩니다.
     * 반환된 값이 관리 자원이라면 계산 완료 후에는 이미 닫힌 상태입니다.</p>
     *
     * @param monad 호스트 effect
     * @return 자원 값 계산
     */
    default Effect<F, A> run(Monad<F> monad) {
        return monad.flatMap(acquire(), handle ->
            monad.map(handle.release(), released -> handle.value()));
    }

    /**
     * 획득한 값으로 후속 계산을 실행한 뒤 반납.
     *
     * <p>release는 후속 계산이 완료된 뒤, 최종 결과가 드러나기 전에 실행됩니다.
     * 후속 계산이 실패했을 때도 반납이 필요하다면
     * {@link com.ryuqq.raii.core.composition.ResourceFactoryMonadError#using(ResourceFactory, Function)}를 사용하세요.</p>
     *
     * @param monad 호스트 effect
     * @param continuation 자원 값을 사용하는 후속 계산
     * @param <B> 결과 타입
     * @return 후속 계산 결과
     */
    default <B> Effect<F, B> using(Monad<F> monad, Function<? super A, ? extends Effect<F, B>> continuation) {
        return monad.flatMap(acquire(), handle ->
            monad.flatMap(continuation.apply(handle.value()), result ->
                monad.map(handle.release(), released -> result)));
    }
}
