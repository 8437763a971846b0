package com.ryuqq.worker.runner;

/**
 * Worker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadNamePrefix: 실행 단위 스레드 이름 접두사 (기본 "worker")</li>
 *   <li>daemon: 실행 단위 스레드의 daemon 여부 (기본 true)</li>
 * </ul>
 *
 * <p>daemon=true이면 종료되지 않은 Worker가 JVM 종료를 막지 않습니다.</p>
 *
 * @author Worker Team
 * @since 1.0.0
 * @param threadNamePrefix 스레드 이름 접두사 (null 또는 빈 문자열 불가)
 * @param daemon daemon 스레드 여부
 */
public record WorkerConfig(
    String threadNamePrefix,
    boolean daemon
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadNamePrefix="worker", daemon=true</p>
     */
    public WorkerConfig() {
        this("worker", true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerConfig {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new WorkerConfig(threadNamePrefix, daemon);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withDaemon(boolean daemon) {
        return new WorkerConfig(threadNamePrefix, daemon);
    }
}
