package org.qwed.expressions;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 运算符的操作数个数约束。max 为 {@link #VARIADIC} 表示不设上限。
 */
@Getter
@EqualsAndHashCode
public final class Arity {

    public static final int VARIADIC = -1;

    private final int min;
    private final int max;

    private Arity(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static Arity of(int min, int max) {
        if (min < 0 || (max != VARIADIC && max < min)) {
            throw new IllegalArgumentException("非法元数: [" + min + ", " + max + "]");
        }
        return new Arity(min, max);
    }

    public boolean isVariadic() {
        return max == VARIADIC;
    }

    public boolean accepts(int operandCount) {
        return operandCount >= min && (isVariadic() || operandCount <= max);
    }

    @Override
    public String toString() {
        if (isVariadic()) {
            return ">=" + min;
        }
        return min == max ? String.valueOf(min) : min + ".." + max;
    }
}
