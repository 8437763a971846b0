package com.ryuqq.worker.core.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Owner 측 수신 엔드포인트.
 *
 * <p>수신한 메시지를 지정된 {@link Executor}에서 handler로 전달합니다.
 * 같은 직렬(single-thread) Executor를 공유하는 포트들은 송신 순서 그대로 전달됩니다.
 * Worker는 결과 포트와 제어 포트를 같은 relay Executor에 묶어, 종료 신호 미러가
 * 앞서 보낸 모든 결과보다 나중에 처리되도록 보장합니다.</p>
 *
 * <p><strong>닫힘 규칙:</strong></p>
 * <ul>
 *   <li>{@link #close()} 이후 송신된 메시지는 버려짐</li>
 *   <li>이미 Executor에 예약되었지만 아직 전달되지 않은 메시지도 전달 시점에 버려짐</li>
 * </ul>
 *
 * @param <T> 메시지 타입
 * @author Worker Team
 * @since 1.0.0
 */
public final class ListeningPort<T> {

    private static final Logger log = LoggerFactory.getLogger(ListeningPort.class);

    private final String name;
    private final Executor relay;
    private final Consumer<? super T> handler;
    private volatile boolean closed;

    /**
     * 생성자.
     *
     * @param name 포트 이름 (로그용)
     * @param relay 메시지를 전달할 Executor
     * @param handler 메시지 handler
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ListeningPort(String name, Executor relay, Consumer<? super T> handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (relay == null) {
            throw new IllegalArgumentException("relay cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        this.name = name;
        this.relay = relay;
        this.handler = handler;
    }

    /**
     * 이 포트로 메시지를 보내는 SendPort.
     *
     * @return SendPort
     */
    public SendPort<T> sendPort() {
        return this::deliver;
    }

    /**
     * 포트 닫기 (멱등).
     */
    public void close() {
        closed = true;
    }

    private void deliver(T message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (closed) {
            return;
        }
        try {
            relay.execute(() -> {
                if (!closed) {
                    handler.accept(message);
                }
            });
        } catch (RejectedExecutionException e) {
            // relay가 이미 종료됨: 포트도 닫힌 것으로 취급
            log.debug("Port {} dropped a message, relay already terminated", name);
        }
    }
}
