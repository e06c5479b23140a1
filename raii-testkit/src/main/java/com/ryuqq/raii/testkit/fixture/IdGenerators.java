package com.ryuqq.raii.testkit.fixture;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link FakeResource} id 발급기 모음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdGenerators {

    private IdGenerators() {
    }

    /**
     * "0", "1", "2", ... 순서로 새 id를 발급합니다 (재진입 가능한 자원).
     *
     * @return 순차 id 발급기
     */
    public static Supplier<String> sequential() {
        AtomicInteger next = new AtomicInteger();
        return () -> String.valueOf(next.getAndIncrement());
    }

    /**
     * 항상 같은 id를 발급합니다 (배타적 자원).
     *
     * @param id 고정 id
     * @return 상수 id 발급기
     * @throws IllegalArgumentException id가 null이거나 비어 있는 경우
     */
    public static Supplier<String> constant(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        return () -> id;
    }
}
