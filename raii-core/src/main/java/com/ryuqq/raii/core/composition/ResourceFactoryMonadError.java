package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.outcome.Failed;
import com.ryuqq.raii.core.outcome.Succeeded;
import com.ryuqq.raii.core.resource.Handle;
import com.ryuqq.raii.core.resource.ResourceFactory;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.MonadError;
import com.ryuqq.raii.core.spi.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 호스트 {@link MonadError} 위에서 동작하는 에러 인식 합성.
 *
 * <p>자원을 하나라도 획득한 경로는 최종 값이나 에러가 빠져나가기 전에 반드시 그 자원을
 * 반납합니다. 이것이 이 클래스가 항상 지키는 핵심 계약입니다.</p>
 *
 * <p><strong>에러 분류:</strong></p>
 * <ul>
 *   <li><strong>AcquisitionError:</strong> Handle이 생기기 전 실패 → 반납할 것 없음, 그대로 전파</li>
 *   <li><strong>ContinuationError:</strong> 자원을 쥔 상태에서 다음 팩토리 도출/획득 실패
 *       → 쥔 자원 반납 후 전파</li>
 *   <li><strong>ReleaseError:</strong> release 실행 중 실패 → 아래 우선순위 규칙에 따라 대기 중인 에러를 가릴 수 있음</li>
 * </ul>
 *
 * <p><strong>에러 인식 bind:</strong></p>
 * <pre>
 * 1. A 획득 실패(e)          → e 전파
 * 2. B 도출/획득 실패(e)     → A.release()
 *                              - release 실패(e2) → e2 전파 (release 실패가 우선)
 *                              - release 성공     → e 전파
 * 3. B 획득 성공             → 합성 release:
 *                              B.release() 결과 s 보관 → A.release() 무조건 실행
 *                              - A 실패            → A의 에러 전파 (s 무시)
 *                              - A 성공, s 실패    → s 전파
 *                              - 둘 다 성공        → 성공
 * </pre>
 *
 * <p>바깥(먼저 획득한) 자원의 release 실패는 항상 안쪽 자원의 release 실패보다 우선하며,
 * 두 release는 결과와 상관없이 항상 시도됩니다. 가려진 에러는 WARN 로그로 남깁니다.</p>
 *
 * <p><strong>에러 인식 독립 합성 (map2 / ap):</strong></p>
 * <pre>
 * 1. 두 획득 모두 시도 (호스트 map2로 결합)
 * 2. 한쪽만 실패(e)          → 성공한 쪽 release
 *                              - release 실패(e2) → e2 전파
 *                              - release 성공     → e 전파
 * 3. 둘 다 실패              → 왼쪽 에러 전파
 * 4. 둘 다 성공              → 결합 함수 실패 시 두 자원 반납 후 전파
 *                              합성 release: 두 release 모두 시도, 왼쪽 실패가 우선
 * </pre>
 *
 * @param <F> 호스트 effect witness 타입
 * @param <S> 호스트 에러 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResourceFactoryMonadError<F, S> extends ResourceFactoryMonad<F> {

    private static final Logger log = LoggerFactory.getLogger(ResourceFactoryMonadError.class);

    private final MonadError<F, S> monadError;

    /**
     * 생성자.
     *
     * @param monadError 호스트 effect
     * @throws IllegalArgumentException monadError가 null인 경우
     */
    public ResourceFactoryMonadError(MonadError<F, S> monadError) {
        super(monadError);
        this.monadError = monadError;
    }

    /**
     * 획득이 즉시 {@code error}로 실패하는 팩토리.
     *
     * <p>Handle을 만들지 않으므로 반납할 것도 없습니다.</p>
     *
     * @param error 에러
     * @param <A> 명목상 값 타입
     * @return 실패 팩토리
     */
    public <A> ResourceFactory<F, A> raiseError(S error) {
        return () -> monadError.raiseError(error);
    }

    /**
     * 획득 실패 시 대체 팩토리 획득.
     *
     * <p>획득 시점의 실패만 가로채며, 이후 release 실패는 가로채지 않습니다.</p>
     *
     * @param fa 원본 팩토리
     * @param handler 에러별 대체 팩토리
     * @param <A> 값 타입
     * @return 복구 가능한 팩토리
     */
    public <A> ResourceFactory<F, A> handleError(ResourceFactory<F, A> fa,
                                                Function<? super S, ? extends ResourceFactory<F, A>> handler) {
        return () -> monadError.handleError(fa.acquire(), error -> handler.apply(error).acquire());
    }

    /**
     * 획득 결과를 값으로 옮긴 팩토리.
     *
     * <p>획득이 실패하면 반납할 것이 없는 {@link com.ryuqq.raii.core.outcome.Failed} 값을 돌려줍니다.</p>
     *
     * @param fa 원본 팩토리
     * @param <A> 값 타입
     * @return 실패하지 않는 팩토리
     */
    public <A> ResourceFactory<F, Attempt<S, A>> attempt(ResourceFactory<F, A> fa) {
        return handleError(map(fa, Attempt::<S, A>succeeded), error -> pure(Attempt.<S, A>failed(error)));
    }

    /**
     * 에러 인식 순차 합성.
     *
     * <p>후속 함수는 호스트 계산 안에서 적용되므로, 후속 함수가 던진 예외도
     * 호스트 에러 채널이 표현할 수 있다면 ContinuationError로 취급되어 A가 반납됩니다.</p>
     *
     * @param fa 먼저 획득할 팩토리
     * @param f 다음 팩토리를 만드는 후속 함수
     * @param <A> 바깥 자원 타입
     * @param <B> 안쪽 자원 타입
     * @return 에러 인식 합성 팩토리
     */
    @Override
    public <A, B> ResourceFactory<F, B> flatMap(ResourceFactory<F, A> fa,
                                               Function<? super A, ? extends ResourceFactory<F, B>> f) {
        return () -> monadError.flatMap(fa.acquire(), outer -> acquireInner(outer, f));
    }

    /**
     * 에러 인식 독립 합성.
     *
     * <p>한쪽 획득이 실패해도 다른 쪽에서 얻은 자원은 반납되며, 합성 release는 한쪽 release가
     * 실패해도 다른 쪽 release를 실행합니다. {@link #ap}은 이 메서드를 통해 같은 보장을 받습니다.</p>
     *
     * @param fa 첫 번째 팩토리
     * @param fb 두 번째 팩토리
     * @param f 결합 함수
     * @param <A> 첫 번째 값 타입
     * @param <B> 두 번째 값 타입
     * @param <C> 결합 결과 타입
     * @return 실패 경로에서도 두 자원을 반납하는 팩토리
     */
    @Override
    public <A, B, C> ResourceFactory<F, C> map2(ResourceFactory<F, A> fa, ResourceFactory<F, B> fb,
                                               BiFunction<? super A, ? super B, ? extends C> f) {
        Function<Effect<F, Handle<F, C>>, Effect<F, Handle<F, C>>> flatten = settled -> settled;
        return () -> monadError.flatMap(
            monadError.map2(monadError.attempt(fa.acquire()), monadError.attempt(fb.acquire()),
                (left, right) -> settle(left, right, f)),
            flatten);
    }

    /**
     * 값 변환 (에러 인식).
     *
     * <p>변환 함수가 실패하면 획득한 자원을 반납한 뒤 에러를 전파합니다.</p>
     */
    @Override
    public <A, B> ResourceFactory<F, B> map(ResourceFactory<F, A> fa, Function<? super A, ? extends B> f) {
        return flatMap(fa, a -> point(() -> f.apply(a)));
    }

    /**
     * 획득한 값으로 후속 계산을 실행한 뒤 반납 (에러 인식).
     *
     * <p>후속 계산이 실패해도 자원은 반납되며, 그 release가 실패하면 release 에러가 우선합니다.</p>
     */
    @Override
    public <A, B> Effect<F, B> using(ResourceFactory<F, A> fa,
                                    Function<? super A, ? extends Effect<F, B>> continuation) {
        return run(flatMap(fa, a -> liftEffect(continuation.apply(a))));
    }

    /**
     * 호스트 effect 조회.
     *
     * @return 생성 시 주입된 MonadError
     */
    public MonadError<F, S> monadError() {
        return monadError;
    }

    private <A, B> Effect<F, Handle<F, B>> acquireInner(Handle<F, A> outer,
                                                        Function<? super A, ? extends ResourceFactory<F, B>> f) {
        Effect<F, Attempt<S, Handle<F, B>>> next = monadError.attempt(acquireNext(outer, f));
        return monadError.flatMap(next, attempt -> attempt.fold(
            error -> releaseThenRaise(outer.release(), error),
            inner -> monadError.<Handle<F, B>>point(() -> composite(outer, inner))));
    }

    private <A, B> Effect<F, Handle<F, B>> acquireNext(Handle<F, A> outer,
                                                       Function<? super A, ? extends ResourceFactory<F, B>> f) {
        Effect<F, ResourceFactory<F, B>> next = monadError.point(() -> f.apply(outer.value()));
        return monadError.flatMap(next, ResourceFactory::acquire);
    }

    private <B> Effect<F, B> releaseThenRaise(Effect<F, Unit> release, S error) {
        return monadError.flatMap(monadError.attempt(release), released -> released.fold(
            releaseError -> {
                log.warn("Pending failure {} superseded by release failure {}", error, releaseError);
                return monadError.<B>raiseError(releaseError);
            },
            unit -> monadError.<B>raiseError(error)));
    }

    private <A, B, C> Effect<F, Handle<F, C>> settle(Attempt<S, Handle<F, A>> left,
                                                    Attempt<S, Handle<F, B>> right,
                                                    BiFunction<? super A, ? super B, ? extends C> f) {
        if (left instanceof Succeeded<S, Handle<F, A>> acquiredA
            && right instanceof Succeeded<S, Handle<F, B>> acquiredB) {
            return combine(acquiredA.value(), acquiredB.value(), f);
        }
        if (left instanceof Succeeded<S, Handle<F, A>> acquiredA) {
            return releaseThenRaise(acquiredA.value().release(), ((Failed<S, Handle<F, B>>) right).error());
        }
        S leftError = ((Failed<S, Handle<F, A>>) left).error();
        if (right instanceof Succeeded<S, Handle<F, B>> acquiredB) {
            return releaseThenRaise(acquiredB.value().release(), leftError);
        }
        log.warn("Acquisition failure {} superseded by acquisition failure {}",
            ((Failed<S, Handle<F, B>>) right).error(), leftError);
        return monadError.raiseError(leftError);
    }

    private <A, B, C> Effect<F, Handle<F, C>> combine(Handle<F, A> handleA, Handle<F, B> handleB,
                                                     BiFunction<? super A, ? super B, ? extends C> f) {
        Effect<F, Attempt<S, C>> combined =
            monadError.attempt(monadError.point(() -> f.apply(handleA.value(), handleB.value())));
        return monadError.flatMap(combined, result -> result.fold(
            error -> releaseThenRaise(releaseIndependently(handleA, handleB), error),
            value -> monadError.<Handle<F, C>>point(
                () -> Handle.<F, C>of(value, () -> releaseIndependently(handleA, handleB)))));
    }

    private Effect<F, Unit> releaseIndependently(Handle<F, ?> left, Handle<F, ?> right) {
        Function<Effect<F, Unit>, Effect<F, Unit>> flatten = settled -> settled;
        return monadError.flatMap(
            monadError.map2(monadError.attempt(left.release()), monadError.attempt(right.release()),
                (leftResult, rightResult) -> {
                    if (leftResult instanceof Failed<S, Unit> leftFailed) {
                        if (rightResult instanceof Failed<S, Unit> rightFailed) {
                            log.warn("Release failure {} superseded by release failure {}",
                                rightFailed.error(), leftFailed.error());
                        }
                        return monadError.<Unit>raiseError(leftFailed.error());
                    }
                    return rightResult.fold(monadError::<Unit>raiseError, unit -> monadError.unit());
                }),
            flatten);
    }

    private <A, B> Handle<F, B> composite(Handle<F, A> outer, Handle<F, B> inner) {
        return Handle.of(inner.value(), () -> releaseBoth(outer, inner));
    }

    private Effect<F, Unit> releaseBoth(Handle<F, ?> outer, Handle<F, ?> inner) {
        return monadError.flatMap(monadError.attempt(inner.release()), innerResult ->
            monadError.flatMap(monadError.attempt(outer.release()), outerResult -> outerResult.fold(
                outerError -> {
                    if (innerResult instanceof Failed<S, Unit> innerFailed) {
                        log.warn("Inner release failure {} superseded by outer release failure {}",
                            innerFailed.error(), outerError);
                    }
                    return monadError.<Unit>raiseError(outerError);
                },
                released -> innerResult.fold(monadError::<Unit>raiseError, unit -> monadError.unit()))));
    }
}
