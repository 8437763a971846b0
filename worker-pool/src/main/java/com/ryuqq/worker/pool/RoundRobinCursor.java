package com.ryuqq.worker.pool;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin 커서.
 *
 * <p>불변식: {@code 0 <= current() < size}. k번째 {@link #next()} 호출(0부터)은
 * {@code k mod size}를 반환합니다. 증가와 wrap을 원자적으로 수행하므로
 * 여러 스레드에서 호출해도 불변식이 유지됩니다.</p>
 *
 * @author Worker Team
 * @since 1.0.0
 */
final class RoundRobinCursor {

    private final int size;
    private final AtomicInteger index = new AtomicInteger();

    RoundRobinCursor(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive (current: " + size + ")");
        }
        this.size = size;
    }

    /**
     * 현재 인덱스를 반환하고 다음 인덱스로 이동.
     *
     * @return 이번 호출에 배정된 인덱스
     */
    int next() {
        return index.getAndUpdate(i -> (i + 1) % size);
    }

    /**
     * 다음에 배정될 인덱스.
     *
     * @return 현재 커서 위치
     */
    int current() {
        return index.get();
    }
}
