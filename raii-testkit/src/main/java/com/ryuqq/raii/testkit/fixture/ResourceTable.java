package com.ryuqq.raii.testkit.fixture;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 현재 열려 있는 {@link FakeResource}를 id 기준으로 기록하는 테이블.
 *
 * <p>Contract 테스트는 합성된 ResourceFactory를 실행한 뒤 이 테이블이 비었는지 확인하여
 * 자원 누수 여부를 판정합니다.</p>
 *
 * <p><strong>Thread-safety:</strong> ConcurrentHashMap 기반이므로 병렬 획득/해제를 수행하는
 * 비동기 어댑터에서도 안전하게 사용할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceTable {

    private final Map<String, FakeResource> openResources = new ConcurrentHashMap<>();

    /**
     * 자원을 열린 상태로 등록합니다.
     *
     * @param resource 등록할 자원
     * @throws CannotOpenResourceTwiceException 같은 id의 자원이 이미 열려 있는 경우
     */
    void register(FakeResource resource) {
        FakeResource existing = openResources.putIfAbsent(resource.id(), resource);
        if (existing != null) {
            throw new CannotOpenResourceTwiceException(resource.id());
        }
    }

    /**
     * 자원을 테이블에서 제거합니다.
     *
     * @param resource 제거할 자원 (등록된 인스턴스와 동일해야 함)
     * @throws CannotCloseResourceTwiceException 해당 인스턴스가 등록되어 있지 않은 경우
     */
    void unregister(FakeResource resource) {
        if (!openResources.remove(resource.id(), resource)) {
            throw new CannotCloseResourceTwiceException(resource.id());
        }
    }

    public boolean contains(String id) {
        return openResources.containsKey(id);
    }

    public Optional<FakeResource> get(String id) {
        return Optional.ofNullable(openResources.get(id));
    }

    /**
     * 열려 있는 id 목록 (정렬됨, 스냅샷).
     *
     * @return 열린 자원 id 집합
     */
    public Set<String> ids() {
        return new TreeSet<>(openResources.keySet());
    }

    public boolean isEmpty() {
        return openResources.isEmpty();
    }

    public int size() {
        return openResources.size();
    }

    public void clear() {
        openResources.clear();
    }
}
