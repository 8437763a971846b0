package com.ryuqq.worker.core.stream;

/**
 * {@link ResultStream} 구독자.
 *
 * <p>결과는 {@link #onResult}, 오류는 {@link #onError}(종료 이벤트 아님),
 * 스트림 종료는 {@link #onClose}(정확히 한 번)로 전달됩니다.</p>
 *
 * @param <R> 결과 타입
 * @author Worker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultListener<R> {

    /**
     * 결과 수신.
     *
     * @param result 결과
     */
    void onResult(R result);

    /**
     * 오류 수신. 기본 구현은 아무것도 하지 않습니다.
     *
     * @param error 오류
     */
    default void onError(Throwable error) {
    }

    /**
     * 스트림 종료. 기본 구현은 아무것도 하지 않습니다.
     */
    default void onClose() {
    }
}
