package com.ryuqq.raii.core.composition;

import com.ryuqq.raii.core.spi.Applicative;
import com.ryuqq.raii.core.spi.Monad;
import com.ryuqq.raii.core.spi.MonadError;
import com.ryuqq.raii.core.spi.Nondeterminism;

/**
 * 합성 인스턴스 정적 팩토리.
 *
 * <p>호스트 effect가 제공하는 capability에 맞는 인스턴스를 고르세요.</p>
 * <pre>
 * ResourceFactoryMonadError&lt;SyncIO.Witness, Throwable&gt; factories =
 *     ResourceFactories.monadError(SyncIOEffects.INSTANCE);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceFactories {

    private ResourceFactories() {
    }

    public static <F> ResourceFactoryApplicative<F> applicative(Applicative<F> applicative) {
        return new ResourceFactoryApplicative<>(applicative);
    }

    public static <F> ResourceFactoryMonad<F> monad(Monad<F> monad) {
        return new ResourceFactoryMonad<>(monad);
    }

    public static <F, S> ResourceFactoryMonadError<F, S> monadError(MonadError<F, S> monadError) {
        return new ResourceFactoryMonadError<>(monadError);
    }

    public static <F> ResourceFactoryNondeterminism<F> nondeterminism(Nondeterminism<F> nondeterminism) {
        return new ResourceFactoryNondeterminism<>(nondeterminism);
    }
}
