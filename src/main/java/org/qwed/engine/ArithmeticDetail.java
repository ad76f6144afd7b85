package org.qwed.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 算术核对的结果：计算值与声称值的文本形式。
 */
@Getter
@EqualsAndHashCode
public final class ArithmeticDetail implements EngineDetail {

    private final String computedValue;
    private final String claimedValue;

    public ArithmeticDetail(String computedValue, String claimedValue) {
        this.computedValue = Objects.requireNonNull(computedValue, "computedValue cannot be null");
        this.claimedValue = Objects.requireNonNull(claimedValue, "claimedValue cannot be null");
    }

    @Override
    public String summary() {
        return "computed=" + computedValue + ", claimed=" + claimedValue;
    }

    @Override
    public String toString() {
        return summary();
    }
}
