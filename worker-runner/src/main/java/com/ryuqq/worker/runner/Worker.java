package com.ryuqq.worker.runner;

import com.ryuqq.worker.core.channel.ListeningPort;
import com.ryuqq.worker.core.channel.OneShot;
import com.ryuqq.worker.core.channel.SendPort;
import com.ryuqq.worker.core.exception.WorkerFaultException;
import com.ryuqq.worker.core.exception.WorkerStartException;
import com.ryuqq.worker.core.function.WorkFunction;
import com.ryuqq.worker.core.lifecycle.WorkerState;
import com.ryuqq.worker.core.lifecycle.WorkerStateTransition;
import com.ryuqq.worker.core.message.ControlSignal;
import com.ryuqq.worker.core.message.Inbound;
import com.ryuqq.worker.core.stream.ResultStream;
import com.ryuqq.worker.core.unit.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단일 실행 단위 Worker.
 *
 * <p>전용 스레드(실행 단위) 하나에서 함수를 실행하고, 입력 채널로 입력을 받아
 * 출력 스트림으로 결과를 내보냅니다. Worker와 owner는 채널로만 통신합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>실행 단위 생성 및 setup handshake</li>
 *   <li>입력/종료 신호를 같은 FIFO 큐로 전달</li>
 *   <li>결과를 출력 스트림으로 분기 없이 전달</li>
 *   <li>graceful / forced 종료 프로토콜</li>
 * </ul>
 *
 * <p><strong>종료 프로토콜:</strong></p>
 * <pre>
 * shutdown()
 *   ↓
 * Stop을 입력 큐 끝에 추가 (앞선 입력은 모두 먼저 처리됨)
 *   ↓
 * dispatch loop가 Stop을 꺼냄 → 제어 포트로 Stopped 미러
 *   ↓
 * owner 측 제어 리스너 (relay 스레드):
 *   1. 출력 포트 닫기
 *   2. 결과 스트림 닫기
 *   3. 실행 단위 종료
 *   4. 제어 포트 닫기
 * </pre>
 *
 * <p>출력 포트와 제어 포트는 같은 직렬 relay Executor를 공유하므로, Stopped 미러는
 * 앞서 보낸 모든 결과가 스트림으로 전달된 다음에 처리됩니다.</p>
 *
 * <p><strong>함수 오류:</strong> 실행 단위는 중단되고, 결과 스트림에
 * {@link WorkerFaultException} 오류 이벤트가 전달된 뒤 스트림이 닫힙니다.
 * 재시작이나 재시도는 하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Worker&lt;Integer, Integer&gt; worker = new Worker&lt;&gt;(WorkFunction.of(x -&gt; x * 2));
 * CompletableFuture&lt;List&lt;Integer&gt;&gt; results = worker.outputStream().toList();
 *
 * worker.start().join();
 * worker.sendAll(List.of(1, 2, 3));
 * worker.shutdown();
 *
 * results.join(); // [2, 4, 6]
 * </pre>
 *
 * @param <I> 입력 타입
 * @param <R> 결과 타입
 * @author Worker Team
 * @since 1.0.0
 */
public final class Worker<I, R> implements WorkUnit<I, R> {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final WorkFunction<I, R> function;
    private final WorkerConfig config;
    private final String name;
    private final ResultStream<R> resultStream = new ResultStream<>();

    private volatile WorkerState state = WorkerState.CREATED;
    private volatile SendPort<Inbound<I>> inputPort;
    private ListeningPort<R> outputPort;
    private ListeningPort<ControlSignal> controlPort;
    private OneShot<SendPort<Inbound<I>>> setupChannel;
    private ExecutorService relay;
    private Thread unit;

    /**
     * 생성자 (기본 WorkerConfig 사용).
     *
     * @param function 실행할 함수
     * @throws IllegalArgumentException function이 null인 경우
     */
    public Worker(WorkFunction<I, R> function) {
        this(function, new WorkerConfig());
    }

    /**
     * 생성자.
     *
     * <p>함수 참조만 저장하며 실행 단위는 만들지 않습니다.</p>
     *
     * @param function 실행할 함수
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Worker(WorkFunction<I, R> function, WorkerConfig config) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.function = function;
        this.config = config;
        this.name = config.threadNamePrefix() + "-" + SEQUENCE.incrementAndGet();
    }

    /**
     * 실행 단위 시작.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <ol>
     *   <li>relay Executor와 출력/제어 포트 생성</li>
     *   <li>실행 단위 스레드 시작</li>
     *   <li>setup 채널로 입력 SendPort 수신 (handshake)</li>
     *   <li>RUNNING 전이</li>
     * </ol>
     *
     * @return handshake 완료 시 완료되는 future
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    @Override
    public synchronized CompletableFuture<Void> start() {
        state = WorkerStateTransition.transition(state, WorkerState.STARTED);

        relay = Executors.newSingleThreadExecutor(runnable -> newThread(runnable, name + "-relay"));
        outputPort = new ListeningPort<>(name + "-output", relay, resultStream::emit);
        controlPort = new ListeningPort<>(name + "-control", relay, this::onControlSignal);
        setupChannel = new OneShot<>();

        DispatchLoop<I, R> loop = new DispatchLoop<>(
            name,
            function,
            setupChannel.sendPort(),
            outputPort.sendPort(),
            controlPort.sendPort()
        );
        unit = newThread(loop, name);
        unit.start();

        return setupChannel.receive().thenAccept(this::onHandshake);
    }

    /**
     * {@inheritDoc}
     *
     * <p>shutdown 이후에 보낸 입력은 큐에 들어가지만 처리되지 않습니다.
     * 종료된 Worker로 보낸 입력은 버려집니다.</p>
     */
    @Override
    public void send(I input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }

        SendPort<Inbound<I>> port = inputPort;
        if (port == null) {
            if (state.isTerminal()) {
                log.debug("Worker {} is terminated, input dropped", name);
                return;
            }
            throw new IllegalStateException("Worker " + name + " must be started before send (current: " + state + ")");
        }

        port.send(Inbound.data(input));
    }

    /**
     * {@inheritDoc}
     *
     * <p>종료 신호를 데이터와 같은 FIFO 큐에 넣습니다. 멱등하며, 이미 종료된 경우 아무것도 하지 않습니다.</p>
     *
     * @throws IllegalStateException 시작이 완료되지 않은 경우
     */
    @Override
    public synchronized void shutdown() {
        switch (state) {
            case CREATED, STARTED -> throw new IllegalStateException(
                "Worker " + name + " must be started before shutdown (current: " + state + ")"
            );
            case RUNNING -> {
                state = WorkerStateTransition.transition(state, WorkerState.SHUTTING_DOWN);
                inputPort.send(Inbound.stop());
                log.debug("Worker {} shutdown requested", name);
            }
            case SHUTTING_DOWN, TERMINATED -> log.debug("Worker {} shutdown ignored (current: {})", name, state);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>출력 포트, 결과 스트림, 실행 단위, 제어 포트를 순서대로 즉시 닫습니다.
     * 큐에 남아있거나 진행 중인 입력이 처리되었는지는 보장하지 않습니다.</p>
     */
    @Override
    public void forceShutdown() {
        terminate("forced");
    }

    @Override
    public ResultStream<R> outputStream() {
        return resultStream;
    }

    /**
     * 현재 상태 조회.
     *
     * @return 상태
     */
    public WorkerState state() {
        return state;
    }

    /**
     * Worker 이름 (실행 단위 스레드 이름).
     *
     * @return 이름
     */
    public String name() {
        return name;
    }

    private synchronized void onHandshake(SendPort<Inbound<I>> port) {
        if (state != WorkerState.STARTED) {
            // handshake 전에 강제 종료됨
            return;
        }
        inputPort = port;
        state = WorkerStateTransition.transition(state, WorkerState.RUNNING);
        log.info("Worker {} started", name);
    }

    /**
     * 제어 채널 리스너 (relay 스레드에서 실행).
     *
     * @param signal 제어 신호
     */
    private void onControlSignal(ControlSignal signal) {
        if (signal instanceof ControlSignal.Faulted faulted) {
            log.error("Worker {} terminated by a function fault", name, faulted.cause());
            resultStream.emitError(new WorkerFaultException(name, faulted.cause()));
            terminate("fault");
            return;
        }
        terminate("graceful");
    }

    /**
     * 종료 시퀀스 (graceful, forced, fault 공통).
     *
     * <p>예외를 던지지 않으며, 두 번째 호출부터는 아무것도 하지 않습니다.
     * 결과 스트림은 Worker 모니터 밖에서 닫으므로, 스트림 리스너가 이 Worker나
     * 다른 Worker를 종료해도 모니터가 교차로 잡히지 않습니다.</p>
     *
     * @param reason 종료 사유 (로그용)
     */
    private void terminate(String reason) {
        WorkerState previous;
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            previous = state;
            state = WorkerStateTransition.transition(state, WorkerState.TERMINATED);

            // 1. 출력 포트 닫기
            if (outputPort != null) {
                outputPort.close();
            }
        }

        // 2. 결과 스트림 닫기
        resultStream.close();

        synchronized (this) {
            // 3. 실행 단위 종료
            if (unit != null) {
                unit.interrupt();
            }
            if (setupChannel != null) {
                setupChannel.fail(new WorkerStartException("Worker " + name + " terminated before handshake", null));
            }

            // 4. 제어 포트 닫기
            if (controlPort != null) {
                controlPort.close();
            }
            if (relay != null) {
                relay.shutdown();
            }
        }

        log.info("Worker {} terminated ({}, previous state: {})", name, reason, previous);
    }

    private Thread newThread(Runnable runnable, String threadName) {
        Thread thread = new Thread(runnable, threadName);
        thread.setDaemon(config.daemon());
        return thread;
    }
}
