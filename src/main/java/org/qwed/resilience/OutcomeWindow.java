package org.qwed.resilience;

import java.util.Arrays;

/**
 * 最近 N 次调用结果的环形缓冲区。非线程安全，由 {@link CircuitBreaker} 的锁保护。
 */
final class OutcomeWindow {

    private final boolean[] failures;
    private int next = 0;
    private int recorded = 0;
    private int failureCount = 0;

    OutcomeWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.failures = new boolean[capacity];
    }

    void record(boolean failure) {
        if (recorded == failures.length && failures[next]) {
            // 覆盖最旧的一条
            failureCount--;
        }
        failures[next] = failure;
        if (failure) {
            failureCount++;
        }
        next = (next + 1) % failures.length;
        recorded = Math.min(recorded + 1, failures.length);
    }

    int size() {
        return recorded;
    }

    int failures() {
        return failureCount;
    }

    double failureRate() {
        return recorded == 0 ? 0.0 : (double) failureCount / recorded;
    }

    void clear() {
        Arrays.fill(failures, false);
        next = 0;
        recorded = 0;
        failureCount = 0;
    }
}
