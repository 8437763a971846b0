package com.ryuqq.worker.pool;

import com.ryuqq.worker.core.exception.WorkerFaultException;
import com.ryuqq.worker.core.function.WorkFunction;
import com.ryuqq.worker.core.stream.ResultListener;
import com.ryuqq.worker.core.stream.ResultStream;
import com.ryuqq.worker.core.unit.WorkUnit;
import com.ryuqq.worker.runner.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 같은 함수를 실행하는 Worker 묶음.
 *
 * <p>입력을 Worker들에게 round-robin으로 분배하고(fan-out), 모든 Worker의 출력을
 * 하나의 스트림으로 합칩니다(fan-in).</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>생성 시 정확히 workerCount개의 Worker 생성 (이후 변경 불가)</li>
 *   <li>i번째 send를 {@code workers[i mod workerCount]}로 전달</li>
 *   <li>Worker 출력 스트림 병합</li>
 *   <li>shutdown / forceShutdown을 모든 Worker에 전달</li>
 * </ul>
 *
 * <p><strong>순서:</strong> 병합 스트림의 순서는 Worker들의 실제 완료 순서이며,
 * 입력 순서와 무관합니다. 같은 Worker로 간 입력끼리는 (동기 함수인 경우) 순서가 유지됩니다.</p>
 *
 * <p><strong>종료:</strong> 각 Worker는 독립적으로 남은 입력을 처리한 후 종료합니다.
 * 병합 스트림은 모든 Worker 스트림이 닫힌 후에 닫히므로, 스트림 종료가
 * 곧 "모든 Worker 종료" 신호입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkerPool&lt;Integer, Integer&gt; pool = new WorkerPool&lt;&gt;(WorkFunction.of(x -&gt; x), 4);
 * CompletableFuture&lt;List&lt;Integer&gt;&gt; results = pool.outputStream().toList();
 *
 * pool.start().join();
 * pool.sendAll(List.of(0, 1, 2, 3, 4, 5, 6, 7));
 * pool.shutdown();
 *
 * results.join(); // 0..7 (Worker 간 순서는 보장하지 않음)
 * </pre>
 *
 * @param <I> 입력 타입
 * @param <R> 결과 타입
 * @author Worker Team
 * @since 1.0.0
 */
public final class WorkerPool<I, R> implements WorkUnit<I, R> {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final List<Worker<I, R>> workers;
    private final RoundRobinCursor cursor;
    private final ResultStream<R> mergedOutput = new ResultStream<>();
    private final AtomicInteger openStreams;
    private final AtomicBoolean started = new AtomicBoolean();

    /**
     * 생성자 (기본 Worker 수 8).
     *
     * @param function 실행할 함수
     * @throws IllegalArgumentException function이 null인 경우
     */
    public WorkerPool(WorkFunction<I, R> function) {
        this(function, new PoolConfig());
    }

    /**
     * 생성자.
     *
     * @param function 실행할 함수
     * @param workerCount Worker 수
     * @throws IllegalArgumentException function이 null이거나 workerCount가 양수가 아닌 경우
     */
    public WorkerPool(WorkFunction<I, R> function, int workerCount) {
        this(function, new PoolConfig().withWorkerCount(workerCount));
    }

    /**
     * 생성자.
     *
     * <p>Worker들을 생성하고 각 출력 스트림을 병합 스트림에 연결합니다.
     * 실행 단위는 {@link #start()}에서 만들어집니다.</p>
     *
     * @param function 실행할 함수
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerPool(WorkFunction<I, R> function, PoolConfig config) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.cursor = new RoundRobinCursor(config.workerCount());
        this.openStreams = new AtomicInteger(config.workerCount());

        List<Worker<I, R>> created = new ArrayList<>(config.workerCount());
        for (int i = 0; i < config.workerCount(); i++) {
            Worker<I, R> worker = new Worker<>(function, config.workerConfig());
            worker.outputStream().listen(new MergingListener());
            created.add(worker);
        }
        this.workers = List.copyOf(created);
    }

    /**
     * 모든 Worker를 순서대로 시작.
     *
     * <p>각 Worker의 시작 완료를 기다린 다음 다음 Worker를 시작합니다 (동시 시작 아님).</p>
     *
     * @return 모든 Worker 시작 시 완료되는 future
     * @throws IllegalStateException 이미 시작된 경우
     */
    @Override
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("WorkerPool has already been started");
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Worker<I, R> worker : workers) {
            chain = chain.thenCompose(ignored -> worker.start());
        }
        return chain.thenRun(() -> log.info("WorkerPool started with {} worker(s)", workers.size()));
    }

    /**
     * {@inheritDoc}
     *
     * <p>{@code workers[cursor]}로 전달한 뒤 커서를 {@code (cursor + 1) mod workerCount}로 이동합니다.</p>
     */
    @Override
    public void send(I input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        workers.get(cursor.next()).send(input);
    }

    /**
     * 모든 Worker에 graceful 종료 요청.
     *
     * <p>각 Worker는 자신의 큐를 모두 처리한 후 독립적으로 종료합니다.</p>
     */
    @Override
    public void shutdown() {
        log.debug("WorkerPool shutdown requested");
        for (Worker<I, R> worker : workers) {
            worker.shutdown();
        }
    }

    /**
     * 모든 Worker를 즉시 종료.
     */
    @Override
    public void forceShutdown() {
        log.debug("WorkerPool force shutdown requested");
        for (Worker<I, R> worker : workers) {
            worker.forceShutdown();
        }
    }

    /**
     * 병합된 결과 스트림.
     *
     * @return 모든 Worker 출력이 합쳐진 스트림
     */
    @Override
    public ResultStream<R> outputStream() {
        return mergedOutput;
    }

    /**
     * Worker 수.
     *
     * @return 생성 시 고정된 Worker 수
     */
    public int workerCount() {
        return workers.size();
    }

    /**
     * Worker 목록 (생성 순서, 변경 불가).
     *
     * @return Worker 목록
     */
    public List<Worker<I, R>> workers() {
        return workers;
    }

    /**
     * Worker 출력을 병합 스트림으로 전달하는 리스너.
     */
    private final class MergingListener implements ResultListener<R> {

        @Override
        public void onResult(R result) {
            mergedOutput.emit(result);
        }

        @Override
        public void onError(Throwable error) {
            if (error instanceof WorkerFaultException fault) {
                log.warn("WorkerPool lost worker {}, remaining workers keep running", fault.getWorkerName());
            }
            mergedOutput.emitError(error);
        }

        @Override
        public void onClose() {
            if (openStreams.decrementAndGet() == 0) {
                mergedOutput.close();
                log.info("WorkerPool terminated, all worker streams closed");
            }
        }
    }
}
