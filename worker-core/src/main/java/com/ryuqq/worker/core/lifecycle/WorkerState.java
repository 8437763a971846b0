package com.ryuqq.worker.core.lifecycle;

/**
 * Worker의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → STARTED (start 호출, 실행 단위 생성)</li>
 *   <li>STARTED → RUNNING (handshake 완료)</li>
 *   <li>RUNNING → SHUTTING_DOWN (shutdown 호출)</li>
 *   <li>종료 상태가 아닌 모든 상태 → TERMINATED (종료 신호 미러, 강제 종료, 함수 오류)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * CREATED
 *    │ start()
 *    ▼
 * STARTED
 *    │ handshake
 *    ▼
 * RUNNING
 *    │ shutdown()
 *    ▼
 * SHUTTING_DOWN
 *    │ 종료 신호 미러 수신
 *    ▼
 * TERMINATED  ◄── forceShutdown() (어느 상태에서든)
 * </pre>
 *
 * @author Worker Team
 * @since 1.0.0
 */
public enum WorkerState {

    /**
     * 생성됨 (실행 단위 없음).
     */
    CREATED,

    /**
     * 실행 단위 생성됨, handshake 대기 중.
     */
    STARTED,

    /**
     * 입력 수신 가능.
     */
    RUNNING,

    /**
     * 종료 신호가 큐에 들어감, 남은 입력 처리 중.
     */
    SHUTTING_DOWN,

    /**
     * 종료됨 (최종).
     */
    TERMINATED;

    /**
     * 종료 상태인지 확인.
     *
     * @return TERMINATED인 경우 true
     */
    public boolean isTerminal() {
        return this == TERMINATED;
    }
}
