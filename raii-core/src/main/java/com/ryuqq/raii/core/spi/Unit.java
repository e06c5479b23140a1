package com.ryuqq.raii.core.spi;

/**
 * The single value carried by computations that only matter for their effect,
 * such as a release action.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Unit {
    INSTANCE;

    @Override
    public String toString() {
        return "()";
    }
}
