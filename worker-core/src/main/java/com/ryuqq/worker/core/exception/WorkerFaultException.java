package com.ryuqq.worker.core.exception;

/**
 * Worker 함수가 오류를 일으켜 실행 단위가 중단되었음을 알리는 예외.
 *
 * <p>호출자에게 던져지지 않고, Worker의 출력 스트림에 오류 이벤트로 전달됩니다.
 * 이 이벤트 직후 출력 스트림은 닫힙니다.</p>
 *
 * @author Worker Team
 * @since 1.0.0
 */
public class WorkerFaultException extends RuntimeException {

    private final String workerName;

    /**
     * 생성자.
     *
     * @param workerName 오류가 발생한 Worker 이름
     * @param cause 함수가 던진 원인
     */
    public WorkerFaultException(String workerName, Throwable cause) {
        super("Worker " + workerName + " terminated by a function fault: " + describe(cause), cause);
        this.workerName = workerName;
    }

    /**
     * 오류가 발생한 Worker 이름.
     *
     * @return Worker 이름
     */
    public String getWorkerName() {
        return workerName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
