package com.ryuqq.worker.core.channel;

import java.util.concurrent.LinkedBlockingQueue;

/**
 * Worker 측 수신 엔드포인트 (무제한 FIFO 큐).
 *
 * <p>실행 단위 내부에서 생성되며, {@link #sendPort()}만 handshake를 통해 owner에게 전달됩니다.
 * 큐는 메모리가 허용하는 한 제한이 없습니다 (backpressure 없음).</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>송신: 여러 스레드에서 동시 호출 가능</li>
 *   <li>수신({@link #take()}): 소유 실행 단위 하나만 호출</li>
 * </ul>
 *
 * @param <T> 메시지 타입
 * @author Worker Team
 * @since 1.0.0
 */
public final class Mailbox<T> {

    private final LinkedBlockingQueue<T> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    /**
     * 이 mailbox로 메시지를 보내는 SendPort.
     *
     * @return SendPort
     */
    public SendPort<T> sendPort() {
        return this::offer;
    }

    /**
     * 다음 메시지를 FIFO 순서로 꺼냄 (없으면 대기).
     *
     * @return 다음 메시지
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public T take() throws InterruptedException {
        return queue.take();
    }

    /**
     * mailbox 닫기.
     *
     * <p>남아있는 메시지는 버려지고, 이후 송신은 무시됩니다. 멱등합니다.</p>
     */
    public void close() {
        closed = true;
        queue.clear();
    }

    /**
     * 대기 중인 메시지 수.
     *
     * @return 큐 크기
     */
    public int size() {
        return queue.size();
    }

    private void offer(T message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (closed) {
            return;
        }
        queue.offer(message);
    }
}
