package com.ryuqq.raii.testkit.fixture;

/**
 * 획득/해제를 {@link EventLog}에 기록하는 자원.
 *
 * <p>생성 시 "acquire name", close() 시 "release name"을 기록합니다.
 * {@link #failingOnClose(EventLog, String)}로 만든 인스턴스는 이벤트를 기록한 뒤
 * {@link ReleaseFailedException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingResource implements AutoCloseable {

    private final EventLog eventLog;
    private final String name;
    private final boolean failOnClose;

    private RecordingResource(EventLog eventLog, String name, boolean failOnClose) {
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.eventLog = eventLog;
        this.name = name;
        this.failOnClose = failOnClose;
        eventLog.acquired(name);
    }

    public static RecordingResource open(EventLog eventLog, String name) {
        return new RecordingResource(eventLog, name, false);
    }

    public static RecordingResource failingOnClose(EventLog eventLog, String name) {
        return new RecordingResource(eventLog, name, true);
    }

    public String name() {
        return name;
    }

    @Override
    public void close() {
        eventLog.released(name);
        if (failOnClose) {
            throw new ReleaseFailedException(name);
        }
    }

    @Override
    public String toString() {
        return "RecordingResource{name='" + name + "'}";
    }
}
