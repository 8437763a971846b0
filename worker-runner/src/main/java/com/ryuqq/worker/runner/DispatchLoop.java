package com.ryuqq.worker.runner;

import com.ryuqq.worker.core.channel.Mailbox;
import com.ryuqq.worker.core.channel.SendPort;
import com.ryuqq.worker.core.function.WorkFunction;
import com.ryuqq.worker.core.message.ControlSignal;
import com.ryuqq.worker.core.message.Inbound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 단위 내부에서 도는 dispatch loop.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run() 시작
 *   ↓
 * 1. Mailbox 생성 → setup 채널로 Mailbox SendPort 전송 (1회)
 *   ↓
 * 2. mailbox.take() (FIFO)
 *   ↓
 * 3. Stop → 입력 수신 중단
 *          → 진행 중인 Deferred 결과 전달 대기
 *          → 제어 포트로 Stopped 1회 전송 후 종료
 *          (Stop은 출력 포트로 전달하지 않음)
 *   ↓
 * 4. Data → function 호출
 *      - Immediate: 결과를 출력 포트로 즉시 전달
 *      - Deferred: 완료 콜백에서 결과를 출력 포트로 전달
 *   ↓
 * 5. 함수 오류 → 제어 포트로 Faulted 1회 전송 후 종료
 * </pre>
 *
 * <p><strong>순서:</strong> Immediate 함수의 결과는 입력 순서를 따릅니다.
 * Deferred 결과가 겹치면 완료 순서대로 출력되므로, 나중에 dispatch된 입력의 결과가
 * 먼저 도착할 수 있습니다.</p>
 *
 * <p><strong>제어 신호:</strong> Stopped와 Faulted 중 하나만, 정확히 한 번 전송됩니다.</p>
 *
 * @param <I> 입력 타입
 * @param <R> 결과 타입
 * @author Worker Team
 * @since 1.0.0
 */
final class DispatchLoop<I, R> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final String workerName;
    private final WorkFunction<I, R> function;
    private final SendPort<SendPort<Inbound<I>>> setupPort;
    private final SendPort<R> outputPort;
    private final SendPort<ControlSignal> controlPort;
    private final InFlightTracker inFlight = new InFlightTracker();
    private final AtomicBoolean signalled = new AtomicBoolean();

    DispatchLoop(String workerName,
                 WorkFunction<I, R> function,
                 SendPort<SendPort<Inbound<I>>> setupPort,
                 SendPort<R> outputPort,
                 SendPort<ControlSignal> controlPort) {
        this.workerName = workerName;
        this.function = function;
        this.setupPort = setupPort;
        this.outputPort = outputPort;
        this.controlPort = controlPort;
    }

    @Override
    public void run() {
        Mailbox<Inbound<I>> mailbox = new Mailbox<>();
        try {
            // 1. handshake: 입력 SendPort를 owner에게 전달
            setupPort.send(mailbox.sendPort());

            // 2~5. 입력 처리
            dispatch(mailbox);
        } catch (InterruptedException e) {
            // forceShutdown 또는 오류 후 owner가 실행 단위를 중단함
            Thread.currentThread().interrupt();
            log.debug("Worker {} dispatch loop interrupted with {} queued input(s)", workerName, mailbox.size());
        } finally {
            mailbox.close();
        }
    }

    private void dispatch(Mailbox<Inbound<I>> mailbox) throws InterruptedException {
        while (!signalled.get()) {
            Inbound<I> message = mailbox.take();

            if (message instanceof Inbound.Data<I> data) {
                invoke(data.value());
                continue;
            }

            // Stop: 이후 입력은 읽지 않음
            log.debug("Worker {} received stop, draining {} deferred result(s)", workerName, inFlight.size());
            inFlight.awaitDrained();
            signal(new ControlSignal.Stopped());
            return;
        }
    }

    private void invoke(I input) {
        try {
            if (function instanceof WorkFunction.Immediate<I, R> immediate) {
                outputPort.send(requireResult(immediate.apply(input)));
            } else if (function instanceof WorkFunction.Deferred<I, R> deferred) {
                track(deferred.apply(input));
            }
        } catch (RuntimeException e) {
            fault(e);
        }
    }

    private void track(CompletionStage<R> stage) {
        if (stage == null) {
            throw new IllegalStateException("Deferred function returned a null CompletionStage");
        }
        inFlight.begin();
        stage.whenComplete((result, error) -> {
            try {
                if (error != null) {
                    fault(unwrap(error));
                } else if (!signalled.get()) {
                    outputPort.send(requireResult(result));
                }
            } catch (RuntimeException e) {
                fault(e);
            } finally {
                inFlight.end();
            }
        });
    }

    private R requireResult(R result) {
        if (result == null) {
            throw new IllegalStateException("Worker function returned null");
        }
        return result;
    }

    private void fault(Throwable cause) {
        if (signal(new ControlSignal.Faulted(cause))) {
            log.debug("Worker {} function fault signalled: {}", workerName, cause.toString());
        }
    }

    private boolean signal(ControlSignal signal) {
        if (!signalled.compareAndSet(false, true)) {
            return false;
        }
        controlPort.send(signal);
        return true;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
