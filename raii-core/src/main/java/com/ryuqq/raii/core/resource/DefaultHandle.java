package com.ryuqq.raii.core.resource;

import com.ryuqq.raii.core.spi.Effect;
import com.ryuqq.raii.core.spi.Unit;

import java.util.function.Supplier;

/**
 * {@link Handle} 기본 구현.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DefaultHandle<F, A> implements Handle<F, A> {

    private final A value;
    private final Supplier<? extends Effect<F, Unit>> release;

    DefaultHandle(A value, Supplier<? extends Effect<F, Unit>> release) {
        if (release == null) {
            throw new IllegalArgumentException("release cannot be null");
        }
        this.value = value;
        this.release = release;
    }

    @Override
    public A value() {
        return value;
    }

    @Override
    public Effect<F, Unit> release() {
        return release.get();
    }

    @Override
    public String toString() {
        return "Handle{value=" + value + "}";
    }
}
