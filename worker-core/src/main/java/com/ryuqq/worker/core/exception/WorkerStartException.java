package com.ryuqq.worker.core.exception;

/**
 * Worker 시작(handshake) 실패.
 *
 * @author Worker Team
 * @since 1.0.0
 */
public class WorkerStartException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public WorkerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
