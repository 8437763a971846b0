package com.ryuqq.worker.core.unit;

import com.ryuqq.worker.core.stream.ResultStream;

import java.util.concurrent.CompletableFuture;

/**
 * 함수 하나를 격리된 실행 단위에서 처리하는 작업 단위.
 *
 * <p>단일 Worker와 WorkerPool이 같은 형태로 노출하는 공개 연산입니다.</p>
 *
 * <p><strong>사용 흐름:</strong></p>
 * <pre>
 * 1. 생성 (실행 단위는 아직 없음)
 * 2. start().join() → 반드시 완료를 기다린 후 사용
 * 3. send / sendAll → 입력 전달 (fire-and-forget)
 * 4. outputStream() → 결과 구독
 * 5. shutdown() → 이미 보낸 입력을 모두 처리한 후 종료
 *    또는 forceShutdown() → 즉시 종료
 * </pre>
 *
 * <p><strong>종료 보장:</strong></p>
 * <ul>
 *   <li>shutdown 이전에 보낸 모든 입력은 종료 전에 함수로 전달됨</li>
 *   <li>shutdown 이후에 보낸 입력은 무시됨 (출력 없음)</li>
 *   <li>출력 스트림은 정확히 한 번 닫힘</li>
 * </ul>
 *
 * @param <I> 입력 타입
 * @param <R> 결과 타입
 * @author Worker Team
 * @since 1.0.0
 */
public interface WorkUnit<I, R> {

    /**
     * 실행 단위 시작.
     *
     * <p>반환된 future가 완료되기 전에 {@link #send}를 호출하면 안 됩니다.</p>
     *
     * @return 시작 완료 시 완료되는 future
     * @throws IllegalStateException 이미 시작된 경우
     */
    CompletableFuture<Void> start();

    /**
     * 입력 전달 (fire-and-forget).
     *
     * @param input 입력 (null 불가)
     * @throws IllegalArgumentException input이 null인 경우
     * @throws IllegalStateException start가 완료되지 않은 경우
     */
    void send(I input);

    /**
     * 모든 입력을 순서대로 전달.
     *
     * @param inputs 입력 목록
     * @throws IllegalArgumentException inputs가 null인 경우
     */
    default void sendAll(Iterable<? extends I> inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        for (I input : inputs) {
            send(input);
        }
    }

    /**
     * 이미 전달된 입력을 모두 처리한 후 종료 (graceful).
     */
    void shutdown();

    /**
     * 대기 중이거나 진행 중인 작업을 버리고 즉시 종료.
     *
     * <p>예외를 던지지 않으며, 여러 번 호출해도 안전합니다.</p>
     */
    void forceShutdown();

    /**
     * 결과 스트림.
     *
     * @return 결과 스트림 (종료 후 닫힘)
     */
    ResultStream<R> outputStream();
}
