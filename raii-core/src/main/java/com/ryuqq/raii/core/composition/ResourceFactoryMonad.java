package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.resource.Handle;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.Monad;

import java.util.function.Function;

/**
 * 호스트 {@link Monad} 위에서 동작하는 순차 합성 (bind).
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>A 팩토리 획득 → HandleA</li>
 *   <li>후속 함수에 HandleA 값 적용 → B 팩토리</li>
 *   <li>B 팩토리 획득 → HandleB</li>
 *   <li>합성 Handle: 값은 B, release는 <strong>B 먼저, 그다음 A</strong> (LIFO)</li>
 * </ol>
 *
 * <p>합성 획득은 A와 B가 모두 획득될 때까지 완료되지 않으며,
 * release는 합성 Handle을 가진 쪽이 실행할 때까지 미뤄집니다.</p>
 *
 * <p><strong>주의:</strong> 이 인스턴스는 실패를 다루지 않습니다. 후속 함수나 B 획득이 실패하면
 * 이미 획득한 A는 반납되지 않습니다. 호스트에 에러 채널이 있다면
 * {@link ResourceFactoryMonadError}를 사용하세요.</p>
 *
 * @param <F> 호스트 effect witness 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResourceFactoryMonad<F> extends ResourceFactoryApplicative<F> {

    private final Monad<F> monad;

    /**
     * 생성자.
     *
     * @param monad 호스트 effect
     * @throws IllegalArgumentException monad가 null인 경우
     */
    public ResourceFactoryMonad(Monad<F> monad) {
        super(monad);
        this.monad = monad;
    }

    /**
     * 순차 합성.
     *
     * @param fa 먼저 획득할 팩토리
     * @param f A 값으로 다음 팩토리를 만드는 후속 함수
     * @param <A> 바깥 자원 타입
     * @param <B> 안쪽 자원 타입
     * @return 두 자원을 LIFO 순서로 반납하는 팩토리
     */
    public <A, B> ResourceFactory<F, B> flatMap(ResourceFactory<F, A> fa,
                                               Function<? super A, ? extends ResourceFactory<F, B>> f) {
        return () -> monad.flatMap(fa.acquire(), outer ->
            monad.map(f.apply(outer.value()).acquire(), inner ->
                Handle.<F, B>of(inner.value(), () ->
                    monad.flatMap(inner.release(), released -> outer.release()))));
    }

    /**
     * 팩토리를 만드는 팩토리 평탄화.
     *
     * @param ffa 중첩 팩토리
     * @param <A> 값 타입
     * @return 평탄화된 팩토리
     */
    public <A> ResourceFactory<F, A> flatten(ResourceFactory<F, ResourceFactory<F, A>> ffa) {
        return flatMap(ffa, inner -> inner);
    }

    /**
     * 획득 후 즉시 반납하고 값만 반환.
     *
     * @param fa 팩토리
     * @param <A> 값 타입
     * @return 값 계산
     * @see ResourceFactory#run(Monad)
     */
    public <A> Effect<F, A> run(ResourceFactory<F, A> fa) {
        return fa.run(monad);
    }

    /**
     * 획득한 값으로 후속 계산을 실행한 뒤 반납.
     *
     * @param fa 팩토리
     * @param continuation 후속 계산
     * @param <A> 자원 타입
     * @param <B> 결과 타입
     * @return 후속 계산 결과
     * @see ResourceFactory#using(Monad, Function)
     */
    public <A, B> Effect<F, B> using(ResourceFactory<F, A> fa,
                                    Function<? super A, ? extends Effect<F, B>> continuation) {
        return fa.using(monad, continuation);
    }

    /**
     * 호스트 effect 조회.
     *
     * @return 생성 시 주입된 Monad
     */
    public Monad<F> monad() {
        return monad;
    }
}
