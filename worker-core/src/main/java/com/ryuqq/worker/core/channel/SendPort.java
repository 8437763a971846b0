package com.ryuqq.worker.core.channel;

/**
 * 단방향 채널의 송신 권한.
 *
 * <p>send는 fire-and-forget입니다. 블로킹하지 않으며, 수신 측이 살아있는지
 * 여부를 알려주지 않습니다. 닫힌 채널로 보낸 메시지는 버려집니다.</p>
 *
 * @param <T> 메시지 타입
 * @author Worker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SendPort<T> {

    /**
     * 메시지 송신.
     *
     * @param message 송신할 메시지 (null 불가)
     * @throws IllegalArgumentException message가 null인 경우
     */
    void send(T message);
}
