package com.ryuqq.worker.testkit;

import com.ryuqq.worker.core.stream.ResultListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe {@link ResultListener} that records every event for test assertions.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ResultCollector&lt;Integer&gt; collector = new ResultCollector&lt;&gt;();
 * worker.outputStream().listen(collector);
 * ...
 * assertThat(collector.awaitClose(5, TimeUnit.SECONDS)).isTrue();
 * assertThat(collector.results()).containsExactly(1, 2, 3);
 * </pre>
 *
 * @param <R> result type
 * @author Worker Team
 * @since 1.0.0
 */
public class ResultCollector<R> implements ResultListener<R> {

    private final List<R> results = new ArrayList<>();
    private final List<Throwable> errors = new ArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final CountDownLatch closed = new CountDownLatch(1);

    @Override
    public synchronized void onResult(R result) {
        results.add(result);
    }

    @Override
    public synchronized void onError(Throwable error) {
        errors.add(error);
    }

    @Override
    public void onClose() {
        closeCount.incrementAndGet();
        closed.countDown();
    }

    /**
     * Waits until the stream closes.
     *
     * @param timeout maximum time to wait
     * @param unit time unit
     * @return true if the stream closed within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitClose(long timeout, TimeUnit unit) throws InterruptedException {
        return closed.await(timeout, unit);
    }

    /**
     * Returns a snapshot of received results in arrival order.
     *
     * @return results
     */
    public synchronized List<R> results() {
        return new ArrayList<>(results);
    }

    /**
     * Returns a snapshot of received error events.
     *
     * @return errors
     */
    public synchronized List<Throwable> errors() {
        return new ArrayList<>(errors);
    }

    /**
     * Returns how many times onClose was delivered.
     *
     * @return close count
     */
    public int closeCount() {
        return closeCount.get();
    }

    /**
     * Returns whether onClose has been delivered.
     *
     * @return true if closed
     */
    public boolean isClosed() {
        return closed.getCount() == 0;
    }
}
