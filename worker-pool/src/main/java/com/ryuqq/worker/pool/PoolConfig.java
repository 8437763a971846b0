package com.ryuqq.worker.pool;

import com.ryuqq.worker.runner.WorkerConfig;

/**
 * WorkerPool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: Worker 수 (기본 8, 생성 후 변경 불가)</li>
 *   <li>workerConfig: 각 Worker에 적용할 설정 (기본 threadNamePrefix="pool-worker")</li>
 * </ul>
 *
 * @author Worker Team
 * @since 1.0.0
 * @param workerCount Worker 수 (1 이상이어야 함)
 * @param workerConfig Worker 설정 (null이 아니어야 함)
 */
public record PoolConfig(
    int workerCount,
    WorkerConfig workerConfig
) {

    /**
     * 기본 Worker 수.
     */
    public static final int DEFAULT_WORKER_COUNT = 8;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerCount=8, workerConfig=("pool-worker", daemon=true)</p>
     */
    public PoolConfig() {
        this(DEFAULT_WORKER_COUNT, new WorkerConfig().withThreadNamePrefix("pool-worker"));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PoolConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException(
                "workerCount must be positive (current: " + workerCount + ")"
            );
        }
        if (workerConfig == null) {
            throw new IllegalArgumentException("workerConfig cannot be null");
        }
    }

    /**
     * workerCount만 변경한 새 인스턴스 생성.
     */
    public PoolConfig withWorkerCount(int workerCount) {
        return new PoolConfig(workerCount, workerConfig);
    }

    /**
     * workerConfig만 변경한 새 인스턴스 생성.
     */
    public PoolConfig withWorkerConfig(WorkerConfig workerConfig) {
        return new PoolConfig(workerCount, workerConfig);
    }
}
