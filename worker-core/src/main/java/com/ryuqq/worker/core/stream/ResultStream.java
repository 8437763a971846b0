package com.ryuqq.worker.core.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;

/**
 * 결과의 비동기 시퀀스 (단일 구독).
 *
 * <p>Worker와 WorkerPool의 출력 채널을 표현합니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>구독은 한 번만 가능 (두 번째 {@link #listen}은 {@link IllegalStateException})</li>
 *   <li>구독 전에 발생한 이벤트는 버퍼링되었다가 구독 시 순서대로 재생</li>
 *   <li>close는 정확히 한 번만 효과가 있으며, 닫힌 스트림은 다시 열리지 않음</li>
 *   <li>close 이후의 결과/오류는 조용히 버려짐</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 여러 스레드에서 emit해도 안전하며, 이벤트는 리스너에게
 * 직렬로 전달됩니다. 이벤트는 lock 안에서 큐에 쌓이고, 리스너 호출은 lock 밖에서
 * 한 번에 한 스레드(drainer)만 수행합니다. 다른 스레드가 전달 중이면 emit은 큐에 넣고
 * 바로 반환하며, 큐에 쌓인 이벤트는 전달 중인 스레드가 이어서 처리합니다.</p>
 *
 * <p>따라서 리스너 안에서 같은 스트림이나 다른 스트림으로 emit/close 하거나
 * {@code forceShutdown()}을 호출해도 교착 상태가 생기지 않습니다. 이 경우 중첩 이벤트는
 * 현재 이벤트 처리가 끝난 뒤에 전달됩니다.</p>
 *
 * @param <R> 결과 타입
 * @author Worker Team
 * @since 1.0.0
 */
public final class ResultStream<R> {

    private final Object lock = new Object();
    private final Queue<Event<R>> pending = new ArrayDeque<>();
    private ResultListener<? super R> listener;
    private boolean closed;
    private boolean draining;

    /**
     * 스트림 구독.
     *
     * @param listener 리스너
     * @throws IllegalArgumentException listener가 null인 경우
     * @throws IllegalStateException 이미 구독된 경우
     */
    public void listen(ResultListener<? super R> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (lock) {
            if (this.listener != null) {
                throw new IllegalStateException("ResultStream has already been listened to");
            }
            this.listener = listener;
            draining = true;
        }

        // 구독 전 버퍼 재생
        drain();
    }

    /**
     * 결과 발행.
     *
     * @param result 결과
     */
    public void emit(R result) {
        publish(new ResultEvent<>(result), false);
    }

    /**
     * 오류 발행 (스트림은 닫히지 않음).
     *
     * @param error 오류
     * @throws IllegalArgumentException error가 null인 경우
     */
    public void emitError(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        publish(new ErrorEvent<>(error), false);
    }

    /**
     * 스트림 닫기.
     *
     * @return 이 호출로 닫혔으면 true, 이미 닫혀 있었으면 false
     */
    public boolean close() {
        return publish(new CloseEvent<>(), true);
    }

    /**
     * 닫힘 여부.
     *
     * @return 닫혔으면 true
     */
    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * 스트림이 닫힐 때까지 모든 결과를 수집.
     *
     * <p>이 스트림의 단일 구독을 사용합니다. 오류 이벤트가 도착하면
     * future는 그 오류로 즉시 실패합니다.</p>
     *
     * @return 닫힐 때 결과 목록으로 완료되는 future
     * @throws IllegalStateException 이미 구독된 경우
     */
    public CompletableFuture<List<R>> toList() {
        CompletableFuture<List<R>> future = new CompletableFuture<>();
        List<R> results = new ArrayList<>();
        listen(new ResultListener<R>() {
            @Override
            public void onResult(R result) {
                results.add(result);
            }

            @Override
            public void onError(Throwable error) {
                future.completeExceptionally(error);
            }

            @Override
            public void onClose() {
                future.complete(Collections.unmodifiableList(new ArrayList<>(results)));
            }
        });
        return future;
    }

    private boolean publish(Event<R> event, boolean terminal) {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            if (terminal) {
                closed = true;
            }
            pending.add(event);
            if (listener == null || draining) {
                return true;
            }
            draining = true;
        }
        drain();
        return true;
    }

    /**
     * 큐에 쌓인 이벤트를 lock 밖에서 리스너에게 전달.
     *
     * <p>호출 전에 {@code draining}을 true로 설정한 스레드만 호출합니다.</p>
     */
    private void drain() {
        while (true) {
            Event<R> event;
            ResultListener<? super R> target;
            synchronized (lock) {
                event = pending.poll();
                if (event == null) {
                    draining = false;
                    return;
                }
                target = listener;
            }
            try {
                event.deliverTo(target);
            } catch (RuntimeException e) {
                synchronized (lock) {
                    draining = false;
                }
                throw e;
            }
        }
    }

    private interface Event<R> {
        void deliverTo(ResultListener<? super R> listener);
    }

    private record ResultEvent<R>(R result) implements Event<R> {
        @Override
        public void deliverTo(ResultListener<? super R> listener) {
            listener.onResult(result);
        }
    }

    private record ErrorEvent<R>(Throwable error) implements Event<R> {
        @Override
        public void deliverTo(ResultListener<? super R> listener) {
            listener.onError(error);
        }
    }

    private record CloseEvent<R>() implements Event<R> {
        @Override
        public void deliverTo(ResultListener<? super R> listener) {
            listener.onClose();
        }
    }
}
