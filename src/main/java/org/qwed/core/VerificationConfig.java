package org.qwed.core;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

import java.util.Map;
import java.util.Optional;

/**
 * 子系统的全部可调参数，由调用方构造后传入。子系统自身不读文件或环境变量。
 * 所有字段都有默认值；{@link #validate()} 拒绝无意义的组合。
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class VerificationConfig {

    /** 输入上限（UTF-8 字节）。 */
    @Builder.Default
    private final int maxInputBytes = 100 * 1024;
    @Builder.Default
    private final int maxDepth = 64;
    @Builder.Default
    private final int maxNodes = 5_000;
    /** POW 允许的最大指数。 */
    @Builder.Default
    private final int maxExponent = 8;
    /** SUM 展开的最大元素个数。 */
    @Builder.Default
    private final int maxSumUnroll = 64;
    @Builder.Default
    private final long solverTimeoutMillis = 5_000L;

    @Builder.Default
    private final int breakerWindowSize = 20;
    @Builder.Default
    private final int breakerMinimumCalls = 10;
    @Builder.Default
    private final double breakerFailureRateThreshold = 0.5;
    @Builder.Default
    private final long breakerCoolDownMillis = 30_000L;

    @Builder.Default
    private final double majorityThreshold = 0.5;
    @Builder.Default
    private final long requestDeadlineMillis = 10_000L;
    @Builder.Default
    private final int engineThreads = 4;
    /** 算术声称值与计算值之间允许的误差。 */
    @Builder.Default
    private final double arithmeticTolerance = 1e-6;

    /** 引擎 id → 可靠性权重，覆盖引擎自带的默认权重。 */
    @Singular
    private final Map<String, Double> engineWeights;

    public static VerificationConfig defaults() {
        return builder().build();
    }

    public Optional<Double> weightOverride(String engineId) {
        return Optional.ofNullable(engineWeights.get(engineId));
    }

    /**
     * 检查参数组合是否合理。
     * @return this，便于链式调用。
     * @throws IllegalArgumentException 参数不合理时抛出。
     */
    public VerificationConfig validate() {
        Validate.isTrue(maxInputBytes > 0, "maxInputBytes must be positive: %d", maxInputBytes);
        Validate.isTrue(maxDepth > 0, "maxDepth must be positive: %d", maxDepth);
        Validate.isTrue(maxNodes > 0, "maxNodes must be positive: %d", maxNodes);
        Validate.isTrue(maxExponent >= 0, "maxExponent cannot be negative: %d", maxExponent);
        Validate.isTrue(maxSumUnroll >= 0, "maxSumUnroll cannot be negative: %d", maxSumUnroll);
        Validate.isTrue(solverTimeoutMillis > 0, "solverTimeoutMillis must be positive: %d", solverTimeoutMillis);
        Validate.isTrue(breakerWindowSize > 0, "breakerWindowSize must be positive: %d", breakerWindowSize);
        Validate.isTrue(breakerMinimumCalls > 0 && breakerMinimumCalls <= breakerWindowSize,
                "breakerMinimumCalls must be in [1, breakerWindowSize]: %d", breakerMinimumCalls);
        Validate.inclusiveBetween(0.0, 1.0, breakerFailureRateThreshold,
                "breakerFailureRateThreshold must be in [0, 1]");
        Validate.isTrue(breakerCoolDownMillis >= 0, "breakerCoolDownMillis cannot be negative: %d", breakerCoolDownMillis);
        Validate.isTrue(majorityThreshold > 0.0 && majorityThreshold <= 1.0,
                "majorityThreshold must be in (0, 1]: %s", majorityThreshold);
        Validate.isTrue(requestDeadlineMillis > 0, "requestDeadlineMillis must be positive: %d", requestDeadlineMillis);
        Validate.isTrue(engineThreads > 0, "engineThreads must be positive: %d", engineThreads);
        Validate.isTrue(arithmeticTolerance >= 0.0, "arithmeticTolerance cannot be negative: %s", arithmeticTolerance);
        engineWeights.forEach((id, weight) ->
                Validate.isTrue(weight != null && weight > 0.0 && weight <= 1.0,
                        "weight of engine %s must be in (0, 1]: %s", id, weight));
        return this;
    }
}
