package org.qwed.resilience;

import lombok.Getter;
import org.apache.commons.lang3.Validate;
import org.qwed.core.VerificationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * 单个引擎的熔断器，三态状态机 + 最近调用结果的环形缓冲区。
 * <ul>
 *     <li>CLOSED → OPEN：窗口内至少有 minimumCalls 条记录，且失败率超过阈值。</li>
 *     <li>OPEN → HALF_OPEN：冷却期结束后的第一次申请（惰性切换），该申请获得唯一的探测许可。</li>
 *     <li>HALF_OPEN → CLOSED：探测成功，清空窗口。</li>
 *     <li>HALF_OPEN → OPEN：探测失败，重新开始冷却。</li>
 * </ul>
 * 被取消的调用不计入窗口；被取消的探测只归还许可，不触发状态切换。
 * 所有状态变更都在本对象的锁内完成，同一引擎的并发请求共享一个实例。
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    @Getter
    private final String name;
    private final int minimumCalls;
    private final double failureRateThreshold;
    private final long coolDownMillis;
    private final LongSupplier clock;

    private final OutcomeWindow window;
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures = 0;
    private long openedAt = -1L;
    private long generation = 0L;
    private boolean probeInFlight = false;

    public CircuitBreaker(String name, int windowSize, int minimumCalls, double failureRateThreshold,
                          long coolDownMillis, LongSupplier clock) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        Validate.isTrue(minimumCalls > 0 && minimumCalls <= windowSize,
                "minimumCalls must be in [1, windowSize]: %d", minimumCalls);
        Validate.inclusiveBetween(0.0, 1.0, failureRateThreshold, "failureRateThreshold must be in [0, 1]");
        Validate.isTrue(coolDownMillis >= 0, "coolDownMillis cannot be negative: %d", coolDownMillis);
        this.window = new OutcomeWindow(windowSize);
        this.minimumCalls = minimumCalls;
        this.failureRateThreshold = failureRateThreshold;
        this.coolDownMillis = coolDownMillis;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public static CircuitBreaker fromConfig(String name, VerificationConfig config, LongSupplier clock) {
        return new CircuitBreaker(name, config.getBreakerWindowSize(), config.getBreakerMinimumCalls(),
                config.getBreakerFailureRateThreshold(), config.getBreakerCoolDownMillis(), clock);
    }

    /**
     * 申请一次调用许可。
     * @return 许可；熔断中或探测已在进行时为空。
     */
    public synchronized Optional<CallPermit> tryAcquire() {
        switch (state) {
            case CLOSED:
                return Optional.of(new CallPermit(generation, false));
            case OPEN:
                if (!coolDownElapsed()) {
                    return Optional.empty();
                }
                transition(CircuitState.HALF_OPEN);
                probeInFlight = true;
                return Optional.of(new CallPermit(generation, true));
            case HALF_OPEN:
                if (probeInFlight) {
                    return Optional.empty();
                }
                probeInFlight = true;
                return Optional.of(new CallPermit(generation, true));
            default:
                throw new IllegalStateException("未知状态: " + state);
        }
    }

    public synchronized void onSuccess(CallPermit permit) {
        if (isStale(permit)) {
            return;
        }
        if (permit.isProbe()) {
            probeInFlight = false;
            window.clear();
            consecutiveFailures = 0;
            transition(CircuitState.CLOSED);
            return;
        }
        consecutiveFailures = 0;
        window.record(false);
    }

    public synchronized void onFailure(CallPermit permit) {
        if (isStale(permit)) {
            return;
        }
        consecutiveFailures++;
        if (permit.isProbe()) {
            probeInFlight = false;
            trip();
            return;
        }
        window.record(true);
        if (shouldTrip()) {
            trip();
        }
    }

    /**
     * 调用被请求截止时间取消：不是引擎自身的失败，不计入窗口。
     */
    public synchronized void onCancelled(CallPermit permit) {
        if (permit.isProbe() && !isStale(permit)) {
            probeInFlight = false;
            logger.debug("熔断器 {} 的探测调用被取消，归还探测许可", name);
        }
    }

    public synchronized CircuitBreakerState snapshot() {
        return new CircuitBreakerState(state, consecutiveFailures, window.failureRate(), window.size(), openedAt);
    }

    public synchronized CircuitState getState() {
        return state;
    }

    // ========== 转换规则 ==========

    boolean shouldTrip() {
        return window.size() >= minimumCalls && window.failureRate() > failureRateThreshold;
    }

    boolean coolDownElapsed() {
        return clock.getAsLong() - openedAt >= coolDownMillis;
    }

    private void trip() {
        openedAt = clock.getAsLong();
        transition(CircuitState.OPEN);
    }

    private boolean isStale(CallPermit permit) {
        return permit.getGeneration() != generation;
    }

    private void transition(CircuitState target) {
        if (state == target) {
            return;
        }
        logger.warn("熔断器 {}: {} → {} (失败率 {}, 连续失败 {})",
                name, state, target, window.failureRate(), consecutiveFailures);
        state = target;
        generation++;
    }
}
