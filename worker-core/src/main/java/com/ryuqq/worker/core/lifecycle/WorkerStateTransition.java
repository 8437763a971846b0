package com.ryuqq.worker.core.lifecycle;

/**
 * Worker 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → STARTED</li>
 *   <li>STARTED → RUNNING</li>
 *   <li>RUNNING → SHUTTING_DOWN</li>
 *   <li>CREATED, STARTED, RUNNING, SHUTTING_DOWN → TERMINATED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> TERMINATED에서는 어떤 상태로도 전이 불가, 역방향 전이 불가</p>
 *
 * @author Worker Team
 * @since 1.0.0
 */
public final class WorkerStateTransition {

    // Utility class - prevent instantiation
    private WorkerStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkerState from, WorkerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED -> to == WorkerState.STARTED || to == WorkerState.TERMINATED;
            case STARTED -> to == WorkerState.RUNNING || to == WorkerState.TERMINATED;
            case RUNNING -> to == WorkerState.SHUTTING_DOWN || to == WorkerState.TERMINATED;
            case SHUTTING_DOWN -> to == WorkerState.TERMINATED;
            case TERMINATED -> false; // 위에서 이미 체크
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 상태 전이.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkerState transition(WorkerState current, WorkerState next) {
        validate(current, next);
        return next;
    }
}
