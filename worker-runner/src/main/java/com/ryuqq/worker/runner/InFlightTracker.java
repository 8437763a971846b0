package com.ryuqq.worker.runner;

/**
 * 아직 완료되지 않은 Deferred 결과 수 추적.
 *
 * <p>종료 신호를 받은 dispatch loop는 진행 중인 Deferred 결과가 모두 출력 포트로
 * 전달될 때까지 기다린 후에 종료 신호를 미러합니다. 개수에 상한은 없습니다.</p>
 */
final class InFlightTracker {

    private final Object lock = new Object();
    private int count;

    void begin() {
        synchronized (lock) {
            count++;
        }
    }

    void end() {
        synchronized (lock) {
            count--;
            if (count == 0) {
                lock.notifyAll();
            }
        }
    }

    int size() {
        synchronized (lock) {
            return count;
        }
    }

    /**
     * 진행 중인 결과가 모두 끝날 때까지 대기.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시 (강제 종료)
     */
    void awaitDrained() throws InterruptedException {
        synchronized (lock) {
            while (count > 0) {
                lock.wait();
            }
        }
    }
}
