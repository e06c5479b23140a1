package com.ryuqq.raii.testkit.fixture;

import java.util.function.Supplier;

/**
 * 배타적으로만 열 수 있는 가짜 자원.
 *
 * <p>생성 시 {@link ResourceTable}에 자신을 등록하고, close() 시 제거합니다.
 * 등록/제거에 성공하면 {@link EventLog}에 "acquire id" / "release id"를 기록합니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>같은 id가 이미 열려 있으면 생성자가 {@link CannotOpenResourceTwiceException}을 던짐</li>
 *   <li>등록된 인스턴스가 아닌 상태에서 close()하면 {@link CannotCloseResourceTwiceException}을 던짐</li>
 * </ul>
 *
 * <p>id를 매번 새로 발급하면(재진입 가능) 같은 Factory를 중첩 획득해도 충돌하지 않고,
 * 상수 id를 쓰면 두 번째 획득에서 충돌이 발생합니다. {@link IdGenerators} 참고.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FakeResource implements AutoCloseable {

    private final ResourceTable table;
    private final EventLog eventLog;
    private final String id;

    /**
     * 생성자 (생성과 동시에 열림).
     *
     * @param table 열린 자원 테이블
     * @param eventLog 이벤트 로그
     * @param idGenerator id 발급기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     * @throws CannotOpenResourceTwiceException 같은 id가 이미 열려 있는 경우
     */
    public FakeResource(ResourceTable table, EventLog eventLog, Supplier<String> idGenerator) {
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.table = table;
        this.eventLog = eventLog;
        this.id = idGenerator.get();
        table.register(this);
        eventLog.acquired(id);
    }

    /**
     * 상수 id 생성자.
     *
     * @param table 열린 자원 테이블
     * @param eventLog 이벤트 로그
     * @param constantId 고정 id
     */
    public FakeResource(ResourceTable table, EventLog eventLog, String constantId) {
        this(table, eventLog, IdGenerators.constant(constantId));
    }

    public String id() {
        return id;
    }

    @Override
    public void close() {
        table.unregister(this);
        eventLog.released(id);
    }

    @Override
    public String toString() {
        return "FakeResource{id='" + id + "'}";
    }
}
