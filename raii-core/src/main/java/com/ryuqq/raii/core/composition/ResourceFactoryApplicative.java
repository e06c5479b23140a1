package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.resource.Handle;
import com.ryuqq.raii.core.resource.ResourceCloseException;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.spi.Applicative;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.Unit;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 호스트 {@link Applicative} 위에서 동작하는 ResourceFactory 합성.
 *
 * <p>데이터 의존이 없는 팩토리들의 독립 합성(ap)과, 순수 값·호스트 계산·관리 자원을
 * 팩토리로 끌어올리는 생성 연산을 제공합니다.</p>
 *
 * <p><strong>독립 합성 (ap / map2):</strong></p>
 * <ul>
 *   <li>두 팩토리의 획득은 호스트의 {@link Applicative#map2} 로 결합됩니다 (동시 실행 가능)</li>
 *   <li>두 release 역시 {@link Applicative#map2} 로 결합되며, 둘 사이 순서는 보장하지 않습니다</li>
 *   <li>서로 무관한 자원의 동시 정리를 허용하기 위한 의도적인 완화입니다</li>
 * </ul>
 *
 * <p><strong>생성 연산:</strong></p>
 * <ul>
 *   <li>{@link #point(Supplier)} / {@link #pure(Object)}: no-op release 값 팩토리</li>
 *   <li>{@link #liftEffect(Effect)}: 호스트 계산을 no-op release 팩토리로</li>
 *   <li>{@link #managed(Supplier)}: {@link AutoCloseable#close()}가 release가 되는 팩토리</li>
 * </ul>
 *
 * @param <F> 호스트 effect witness 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResourceFactoryApplicative<F> {

    private final Applicative<F> applicative;

    /**
     * 생성자.
     *
     * @param applicative 호스트 effect
     * @throws IllegalArgumentException applicative가 null인 경우
     */
    public ResourceFactoryApplicative(Applicative<F> applicative) {
        if (applicative == null) {
            throw new IllegalArgumentException("applicative cannot be null");
        }
        this.applicative = applicative;
    }

    /**
     * 획득 시 공급자를 평가하여 즉시 성공하는 팩토리.
     *
     * <p>공급자는 획득할 때마다 다시 평가됩니다 (메모이즈하지 않음).</p>
     *
     * @param value 지연된 값
     * @param <A> 값 타입
     * @return no-op release 팩토리
     * @throws IllegalArgumentException value가 null인 경우
     */
    public <A> ResourceFactory<F, A> point(Supplier<? extends A> value) {
        if (value == null) {
            throw new IllegalArgumentException("value supplier cannot be null");
        }
        return () -> applicative.point(() -> Handle.<F, A>unreleasable(applicative, value.get()));
    }

    /**
     * 주어진 값으로 즉시 성공하는 팩토리.
     *
     * @param value 값 (null 허용)
     * @param <A> 값 타입
     * @return no-op release 팩토리
     */
    public <A> ResourceFactory<F, A> pure(A value) {
        return point(() -> value);
    }

    /**
     * 호스트 계산을 no-op release 팩토리로 끌어올리기.
     *
     * @param effect 호스트 계산
     * @param <A> 값 타입
     * @return 획득 시 {@code effect}를 실행하는 팩토리
     * @throws IllegalArgumentException effect가 null인 경우
     */
    public <A> ResourceFactory<F, A> liftEffect(Effect<F, A> effect) {
        if (effect == null) {
            throw new IllegalArgumentException("effect cannot be null");
        }
        return () -> applicative.map(effect, a -> Handle.<F, A>unreleasable(applicative, a));
    }

    /**
     * 관리 자원 팩토리.
     *
     * <p>획득할 때마다 {@code constructor}를 다시 평가하여 새 자원을 만들고,
     * 그 자원의 {@link AutoCloseable#close()}를 호스트 계산으로 감싼 것이 release가 됩니다.
     * close()가 던진 unchecked 예외는 그대로, checked 예외는
     * {@link ResourceCloseException}으로 감싸 호스트 에러 채널로 전달됩니다.</p>
     *
     * @param constructor 자원 생성 thunk
     * @param <R> 자원 타입
     * @return 관리 자원 팩토리
     * @throws IllegalArgumentException constructor가 null인 경우
     */
    public <R extends AutoCloseable> ResourceFactory<F, R> managed(Supplier<? extends R> constructor) {
        if (constructor == null) {
            throw new IllegalArgumentException("constructor cannot be null");
        }
        return () -> applicative.map(applicative.<R>point(constructor), resource ->
            Handle.<F, R>of(resource, () -> applicative.point(() -> close(resource))));
    }

    /**
     * 획득한 값을 변환.
     *
     * <p>release는 원래 Handle의 release를 그대로 사용합니다.</p>
     *
     * @param fa 원본 팩토리
     * @param f 변환 함수
     * @param <A> 원본 타입
     * @param <B> 결과 타입
     * @return 변환된 팩토리
     */
    public <A, B> ResourceFactory<F, B> map(ResourceFactory<F, A> fa, Function<? super A, ? extends B> f) {
        return () -> applicative.map(fa.acquire(), handle ->
            Handle.<F, B>of(f.apply(handle.value()), handle::release));
    }

    /**
     * 독립된 두 팩토리 결합.
     *
     * <p>이 인스턴스는 실패 시 아무것도 반납하지 않습니다. 한쪽 획득이 실패하면 다른 쪽 Handle은
     * 열린 채로 남고, 호스트 {@code map2}가 순차적이면 왼쪽 release 실패가 오른쪽 release를
     * 건너뜁니다. 실패 경로까지 반납을 보장하려면 {@link ResourceFactoryMonadError#map2}를 사용하세요.</p>
     *
     * @param fa 첫 번째 팩토리
     * @param fb 두 번째 팩토리
     * @param f 결합 함수
     * @param <A> 첫 번째 값 타입
     * @param <B> 두 번째 값 타입
     * @param <C> 결합 결과 타입
     * @return 두 자원을 모두 소유하는 팩토리
     */
    public <A, B, C> ResourceFactory<F, C> map2(ResourceFactory<F, A> fa, ResourceFactory<F, B> fb,
                                               BiFunction<? super A, ? super B, ? extends C> f) {
        return () -> applicative.map2(fa.acquire(), fb.acquire(), (handleA, handleB) ->
            Handle.<F, C>of(f.apply(handleA.value(), handleB.value()), () ->
                applicative.map2(handleA.release(), handleB.release(), (releasedA, releasedB) -> Unit.INSTANCE)));
    }

    /**
     * 팩토리가 만든 함수를 다른 팩토리의 값에 적용 (독립 합성).
     *
     * @param fa 인자 팩토리
     * @param ff 함수 팩토리
     * @param <A> 인자 타입
     * @param <B> 결과 타입
     * @return 두 자원을 모두 소유하는 팩토리
     */
    public <A, B> ResourceFactory<F, B> ap(ResourceFactory<F, A> fa,
                                          ResourceFactory<F, Function<? super A, ? extends B>> ff) {
        return this.<A, Function<? super A, ? extends B>, B>map2(fa, ff, (a, function) -> function.apply(a));
    }

    /**
     * 호스트 effect 조회.
     *
     * @return 생성 시 주입된 Applicative
     */
    public Applicative<F> applicative() {
        return applicative;
    }

    private static Unit close(AutoCloseable resource) {
        try {
            resource.close();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ResourceCloseException(resource, e);
        }
        return Unit.INSTANCE;
    }
}
