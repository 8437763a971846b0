package com.ryuqq.worker.core.channel;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 일회용 랑데부 채널 (setup handshake 전용).
 *
 * <p>정확히 하나의 값만 운반하고, 한 번만 수신할 수 있습니다.
 * Worker 시작 시 실행 단위가 자신의 입력 SendPort를 owner에게 넘기는 데 사용되며,
 * 이후에는 재사용하지 않고 버립니다.</p>
 *
 * @param <T> 값 타입
 * @author Worker Team
 * @since 1.0.0
 */
public final class OneShot<T> {

    private final CompletableFuture<T> value = new CompletableFuture<>();
    private final AtomicBoolean received = new AtomicBoolean();

    /**
     * 값을 보내는 SendPort.
     *
     * <p>두 번째 송신은 {@link IllegalStateException}을 던집니다.</p>
     *
     * @return SendPort
     */
    public SendPort<T> sendPort() {
        return message -> {
            if (message == null) {
                throw new IllegalArgumentException("message cannot be null");
            }
            if (!value.complete(message)) {
                throw new IllegalStateException("OneShot channel already carried a value");
            }
        };
    }

    /**
     * 값이 도착하기 전에 채널을 실패 처리.
     *
     * @param cause 실패 원인
     * @return 이 호출로 실패 처리되었으면 true
     */
    public boolean fail(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return value.completeExceptionally(cause);
    }

    /**
     * 값 수신 (한 번만 허용).
     *
     * @return 값이 도착하면 완료되는 future
     * @throws IllegalStateException 이미 수신한 경우
     */
    public CompletableFuture<T> receive() {
        if (!received.compareAndSet(false, true)) {
            throw new IllegalStateException("OneShot channel already received");
        }
        return value;
    }
}
