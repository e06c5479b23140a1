package com.ryuqq.raii.core.support;

import com.ryuqq.raii.core.outcome.Attempt;
import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.MonadError;
import com.ryuqq.raii.core.spi.Nondeterminism;
import com.ryuqq.raii.core.spi.RaceResult;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link LazyEffect} 인스턴스.
 *
 * <p>chooseAny는 결정적으로 head를 승자로 하고 tail을 그대로 잔여 계산으로 돌려줍니다.</p>
 */
public final class LazyEffects implements MonadError<LazyEffect.Witness, Throwable>, Nondeterminism<LazyEffect.Witness> {

    @Override
    public <A> Effect<LazyEffect.Witness, A> point(Supplier<? extends A> value) {
        return new LazyEffect<>(() -> Attempt.succeeded(value.get()));
    }

    @Override
    public <A, B> Effect<LazyEffect.Witness, B> flatMap(Effect<LazyEffect.Witness, A> fa,
                                                       Function<? super A, ? extends Effect<LazyEffect.Witness, B>> f) {
        return new LazyEffect<>(() -> LazyEffect.narrow(fa).run().fold(
            Attempt::<Throwable, B>failed,
            a -> LazyEffect.narrow(f.apply(a)).run()));
    }

    @Override
    public <A, B, C> Effect<LazyEffect.Witness, C> map2(Effect<LazyEffect.Witness, A> fa, Effect<LazyEffect.Witness, B> fb,
                                                       BiFunction<? super A, ? super B, ? extends C> f) {
        return flatMap(fa, a -> map(fb, b -> f.apply(a, b)));
    }

    @Override
    public <A> Effect<LazyEffect.Witness, A> raiseError(Throwable error) {
        return new LazyEffect<>(() -> Attempt.failed(error));
    }

    @Override
    public <A> Effect<LazyEffect.Witness, A> handleError(Effect<LazyEffect.Witness, A> fa,
                                                        Function<? super Throwable, ? extends Effect<LazyEffect.Witness, A>> handler) {
        return new LazyEffect<>(() -> LazyEffect.narrow(fa).run().fold(
            error -> LazyEffect.narrow(handler.apply(error)).run(),
            Attempt::<Throwable, A>succeeded));
    }

    @Override
    public <A> Effect<LazyEffect.Witness, RaceResult<LazyEffect.Witness, A>> chooseAny(Effect<LazyEffect.Witness, A> head,
                                                                                      List<Effect<LazyEffect.Witness, A>> tail) {
        return map(head, winner -> new RaceResult<>(winner, tail));
    }
}
