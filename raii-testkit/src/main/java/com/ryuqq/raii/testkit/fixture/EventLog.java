package com.ryuqq.raii.testkit.fixture;

import java.util.ArrayList;
import java.util.List;

/**
 * 획득/해제 이벤트를 발생 순서대로 기록하는 로그.
 *
 * <p>"acquire r0", "release r0" 형태의 문자열을 기록합니다. 모든 메서드는 동기화되어 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventLog {

    private final List<String> events = new ArrayList<>();

    public synchronized void record(String event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    public void acquired(String name) {
        record("acquire " + name);
    }

    public void released(String name) {
        record("release " + name);
    }

    /**
     * 지금까지 기록된 이벤트 (스냅샷).
     *
     * @return 불변 이벤트 목록
     */
    public synchronized List<String> events() {
        return List.copyOf(events);
    }

    public synchronized int count(String event) {
        return (int) events.stream().filter(event::equals).count();
    }

    public synchronized void clear() {
        events.clear();
    }
}
