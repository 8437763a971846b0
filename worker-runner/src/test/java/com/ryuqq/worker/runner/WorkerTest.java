package com.ryuqq.worker.runner;

import com.ryuqq.worker.core.function.WorkFunction;
import com.ryuqq.worker.core.lifecycle.WorkerState;
import com.ryuqq.worker.testkit.ResultCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Worker 유닛 테스트.
 *
 * <p>Worker의 핵심 동작을 검증합니다:</p>
 * <ul>
 *   <li>동기 함수: 입력 순서 = 출력 순서</li>
 *   <li>종료 프로토콜: 종료 신호는 마지막에 처리되고 출력으로 나가지 않음</li>
 *   <li>생명주기: 상태 전이 및 사용 규약 위반</li>
 *   <li>Deferred 함수: 완료 순서대로 출력</li>
 * </ul>
 *
 * @author Worker Team
 * @since 1.0.0
 */
class WorkerTest {

    private static final long TIMEOUT_SECONDS = 5;

    private final List<Worker<?, ?>> workers = new ArrayList<>();

    @AfterEach
    void tearDown() {
        workers.forEach(Worker::forceShutdown);
    }

    private <I, R> Worker<I, R> worker(WorkFunction<I, R> function) {
        Worker<I, R> worker = new Worker<>(function, new WorkerConfig().withThreadNamePrefix("test-worker"));
        workers.add(worker);
        return worker;
    }

    // ============================================================
    // 1. 동기 함수: 순서 보장
    // ============================================================

    @Test
    void 항등_함수로_1부터_5를_보내면_같은_순서로_출력되고_스트림이_닫힘() {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));
        CompletableFuture<List<Integer>> results = worker.outputStream().toList();
        worker.start().join();

        // when
        worker.sendAll(List.of(1, 2, 3, 4, 5));
        worker.shutdown();

        // then
        assertThat(results).succeedsWithin(TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .isEqualTo(List.of(1, 2, 3, 4, 5));
        assertThat(worker.outputStream().isClosed()).isTrue();
    }

    @Test
    void 두배_함수로_1_2_3을_보내면_2_4_6이_순서대로_출력됨() {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x * 2));
        CompletableFuture<List<Integer>> results = worker.outputStream().toList();
        worker.start().join();

        // when
        worker.sendAll(List.of(1, 2, 3));
        worker.shutdown();

        // then
        assertThat(results).succeedsWithin(TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .isEqualTo(List.of(2, 4, 6));
    }

    @Test
    void 대량_입력도_보낸_순서_그대로_출력됨() throws InterruptedException {
        // given
        Worker<Integer, String> worker = worker(WorkFunction.of(x -> "#" + x));
        ResultCollector<String> collector = new ResultCollector<>();
        worker.outputStream().listen(collector);
        worker.start().join();

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            worker.send(i);
            expected.add("#" + i);
        }

        // when
        worker.shutdown();

        // then
        assertThat(collector.awaitClose(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(collector.results()).containsExactlyElementsOf(expected);
    }

    // ============================================================
    // 2. 종료 프로토콜
    // ============================================================

    @Test
    void shutdown_이후_보낸_입력은_출력되지_않음() {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));
        CompletableFuture<List<Integer>> results = worker.outputStream().toList();
        worker.start().join();
        worker.sendAll(List.of(1, 2));

        // when
        worker.shutdown();
        worker.sendAll(List.of(3, 4));

        // then
        assertThat(results).succeedsWithin(TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .isEqualTo(List.of(1, 2));
    }

    @Test
    void shutdown_후_종료되면_상태가_TERMINATED로_전이됨() throws InterruptedException {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));
        ResultCollector<Integer> collector = new ResultCollector<>();
        worker.outputStream().listen(collector);
        worker.start().join();
        assertThat(worker.state()).isEqualTo(WorkerState.RUNNING);

        // when
        worker.shutdown();

        // then
        assertThat(collector.awaitClose(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(worker.state()).isEqualTo(WorkerState.TERMINATED);
    }

    @Test
    void 종료된_Worker로_보낸_입력은_예외_없이_버려짐() {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));
        worker.forceShutdown();

        // when
        worker.send(1);

        // then
        assertThat(worker.state()).isEqualTo(WorkerState.TERMINATED);
        assertThat(worker.outputStream().isClosed()).isTrue();
    }

    @Test
    void forceShutdown_은_대기_중인_입력을_처리하지_않고_즉시_종료함() throws InterruptedException {
        // given: 첫 입력에서 멈추는 함수
        CountDownLatch entered = new CountDownLatch(1);
        CompletableFuture<Void> release = new CompletableFuture<>();
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> {
            entered.countDown();
            release.join();
            return x;
        }));
        ResultCollector<Integer> collector = new ResultCollector<>();
        worker.outputStream().listen(collector);
        worker.start().join();
        worker.sendAll(List.of(1, 2, 3));
        assertThat(entered.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        // when
        worker.forceShutdown();
        release.complete(null);

        // then
        assertThat(collector.isClosed()).isTrue();
        assertThat(collector.results()).isEmpty();
        assertThat(worker.state()).isEqualTo(WorkerState.TERMINATED);
    }

    @Test
    void 출력_리스너_안에서_forceShutdown을_호출해도_교착_없이_종료됨() throws InterruptedException {
        // given: 세 번째 결과에서 스스로 강제 종료하는 리스너
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));
        ResultCollector<Integer> collector = new ResultCollector<>() {
            @Override
            public void onResult(Integer result) {
                super.onResult(result);
                if (result == 2) {
                    worker.forceShutdown();
                }
            }
        };
        worker.outputStream().listen(collector);
        worker.start().join();

        // when
        worker.sendAll(range(10_000));

        // then
        assertThat(collector.awaitClose(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(collector.closeCount()).isEqualTo(1);
        assertThat(collector.results()).startsWith(0, 1, 2).hasSizeLessThan(10_000);
        assertThat(worker.state()).isEqualTo(WorkerState.TERMINATED);
        assertThat(worker.outputStream().isClosed()).isTrue();
    }

    @Test
    void 출력_리스너_안에서_shutdown을_호출하면_그때까지_보낸_입력을_모두_처리하고_종료됨() throws InterruptedException {
        // given: 첫 결과에서 graceful 종료를 요청하는 리스너
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));
        ResultCollector<Integer> collector = new ResultCollector<>() {
            @Override
            public void onResult(Integer result) {
                super.onResult(result);
                if (result == 0) {
                    worker.shutdown();
                }
            }
        };
        worker.outputStream().listen(collector);
        worker.start().join();

        // when
        worker.sendAll(range(100));

        // then: Stop 이전에 큐에 들어간 입력만 처리되고, 순서는 유지됨
        assertThat(collector.awaitClose(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        List<Integer> results = collector.results();
        assertThat(results).isNotEmpty().isEqualTo(range(results.size()));
        assertThat(worker.state()).isEqualTo(WorkerState.TERMINATED);
    }

    // ============================================================
    // 3. 생명주기 / 사용 규약
    // ============================================================

    @Test
    void 생성만_하면_CREATED_상태이고_스레드를_만들지_않음() {
        // when
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));

        // then
        assertThat(worker.state()).isEqualTo(WorkerState.CREATED);
        assertThat(worker.name()).startsWith("test-worker-");
        assertThat(threadExists(worker.name())).isFalse();
    }

    @Test
    void start_후_실행_단위_스레드가_Worker_이름으로_생성됨() {
        // given
        Worker<Integer, String> worker = worker(WorkFunction.of(x -> Thread.currentThread().getName()));
        CompletableFuture<List<String>> results = worker.outputStream().toList();

        // when
        worker.start().join();
        worker.send(1);
        worker.shutdown();

        // then: 함수는 Worker 전용 스레드에서 실행됨
        assertThat(results).succeedsWithin(TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .isEqualTo(List.of(worker.name()));
    }

    @Test
    void start를_두_번_호출하면_IllegalStateException() {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));
        worker.start().join();

        // when & then
        assertThatThrownBy(worker::start)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void start_전에_shutdown하면_IllegalStateException() {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> x));

        // when & then
        assertThatThrownBy(worker::shutdown)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be started");
    }

    @Test
    void 생성자에_null_함수를_넘기면_IllegalArgumentException() {
        assertThatThrownBy(() -> new Worker<Integer, Integer>(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("function cannot be null");
    }

    @Test
    void 생성자에_null_설정을_넘기면_IllegalArgumentException() {
        assertThatThrownBy(() -> new Worker<Integer, Integer>(WorkFunction.of(x -> x), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    // ============================================================
    // 4. Deferred 함수
    // ============================================================

    @Test
    void Deferred_결과는_dispatch_순서가_아닌_완료_순서로_출력됨() throws InterruptedException {
        // given: 입력마다 외부에서 완료시키는 future
        List<CompletableFuture<Integer>> pending = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            pending.add(new CompletableFuture<>());
        }
        Worker<Integer, Integer> worker = worker(WorkFunction.deferred(pending::get));
        ResultCollector<Integer> collector = new ResultCollector<>();
        worker.outputStream().listen(collector);
        worker.start().join();
        worker.sendAll(List.of(0, 1, 2));
        for (CompletableFuture<Integer> future : pending) {
            awaitCallbackRegistered(future);
        }

        // when: 역순으로 완료
        worker.shutdown();
        pending.get(2).complete(20);
        pending.get(1).complete(10);
        pending.get(0).complete(0);

        // then
        assertThat(collector.awaitClose(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(collector.results()).containsExactly(20, 10, 0);
    }

    @Test
    void Deferred_결과가_실패하면_오류_이벤트_후_스트림이_닫힘() throws InterruptedException {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.deferred(
            x -> CompletableFuture.failedFuture(new IllegalStateException("remote failure"))
        ));
        ResultCollector<Integer> collector = new ResultCollector<>();
        worker.outputStream().listen(collector);
        worker.start().join();

        // when
        worker.send(1);

        // then: shutdown 없이도 오류로 종료됨
        assertThat(collector.awaitClose(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(collector.errors()).hasSize(1);
        assertThat(collector.errors().get(0))
            .hasRootCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("remote failure");
        assertThat(worker.state()).isEqualTo(WorkerState.TERMINATED);
    }

    @Test
    void 함수가_null을_반환하면_오류로_처리됨() throws InterruptedException {
        // given
        Worker<Integer, Integer> worker = worker(WorkFunction.of(x -> null));
        ResultCollector<Integer> collector = new ResultCollector<>();
        worker.outputStream().listen(collector);
        worker.start().join();

        // when
        worker.send(1);

        // then
        assertThat(collector.awaitClose(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(collector.errors()).hasSize(1);
        assertThat(collector.results()).isEmpty();
    }

    private static void awaitCallbackRegistered(CompletableFuture<?> future) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (future.getNumberOfDependents() == 0) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("completion callback was never registered");
            }
            Thread.sleep(5);
        }
    }

    private static List<Integer> range(int count) {
        return IntStream.range(0, count).boxed().collect(Collectors.toList());
    }

    private static boolean threadExists(String name) {
        return Thread.getAllStackTraces().keySet().stream()
            .anyMatch(thread -> thread.getName().equals(name));
    }
}
