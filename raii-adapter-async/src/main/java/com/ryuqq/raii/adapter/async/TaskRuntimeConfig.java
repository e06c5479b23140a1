package com.ryuqq.raii.adapter.async;

/**
 * TaskRuntime 설정 (불변 record).
 *
 * <p>이 record는 {@link TaskRuntime}이 소유하는 스레드 풀의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>parallelism: 워커 스레드 수 (기본 = 가용 프로세서 수)</li>
 *   <li>threadNamePrefix: 워커 스레드 이름 접두사 (기본 "raii-task-")</li>
 *   <li>shutdownTimeoutMs: close() 시 진행 중 작업 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>독립 합성(ap)과 경쟁 합성(chooseAny)이 실제로 병렬이 되려면 parallelism이 2 이상이어야 합니다</li>
 *   <li>release가 느린 자원(네트워크 연결 등)을 다룬다면 shutdownTimeoutMs를 늘리세요</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param parallelism 워커 스레드 수 (1 이상이어야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (빈 문자열 불가)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상이어야 함)
 */
public record TaskRuntimeConfig(int parallelism, String threadNamePrefix, long shutdownTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: parallelism=가용 프로세서 수, threadNamePrefix="raii-task-", shutdownTimeoutMs=5000ms</p>
     */
    public TaskRuntimeConfig() {
        this(Runtime.getRuntime().availableProcessors(), "raii-task-", 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TaskRuntimeConfig {
        if (parallelism <= 0) {
            throw new IllegalArgumentException(
                "parallelism must be positive (current: " + parallelism + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must not be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * parallelism만 변경한 새 인스턴스 생성.
     *
     * @param parallelism 새로운 워커 스레드 수
     * @return 새 TaskRuntimeConfig 인스턴스
     */
    public TaskRuntimeConfig withParallelism(int parallelism) {
        return new TaskRuntimeConfig(parallelism, this.threadNamePrefix, this.shutdownTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     *
     * @param threadNamePrefix 새로운 스레드 이름 접두사
     * @return 새 TaskRuntimeConfig 인스턴스
     */
    public TaskRuntimeConfig withThreadNamePrefix(String threadNamePrefix) {
        return new TaskRuntimeConfig(this.parallelism, threadNamePrefix, this.shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param shutdownTimeoutMs 새로운 종료 대기 시간 (밀리초)
     * @return 새 TaskRuntimeConfig 인스턴스
     */
    public TaskRuntimeConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new TaskRuntimeConfig(this.parallelism, this.threadNamePrefix, shutdownTimeoutMs);
    }
}
