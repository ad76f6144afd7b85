package org.qwed.resilience;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.OptionalLong;

/**
 * 熔断器在某一时刻的不可变快照。
 */
@Getter
@EqualsAndHashCode
public final class CircuitBreakerState {

    private final CircuitState state;
    private final int consecutiveFailures;
    private final double windowFailureRate;
    private final int windowSize;
    private final long openedAt;

    CircuitBreakerState(CircuitState state, int consecutiveFailures, double windowFailureRate,
                        int windowSize, long openedAt) {
        this.state = state;
        this.consecutiveFailures = consecutiveFailures;
        this.windowFailureRate = windowFailureRate;
        this.windowSize = windowSize;
        this.openedAt = openedAt;
    }

    /**
     * @return 最近一次打开的时间；从未打开过时为空。
     */
    public OptionalLong getOpenedAt() {
        return openedAt < 0 ? OptionalLong.empty() : OptionalLong.of(openedAt);
    }

    @Override
    public String toString() {
        return state + "(failures=" + consecutiveFailures + ", rate=" + windowFailureRate
                + ", window=" + windowSize + ")";
    }
}
