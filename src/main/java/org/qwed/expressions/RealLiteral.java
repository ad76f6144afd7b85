package org.qwed.expressions;

import lombok.Getter;
import org.qwed.errors.SourcePosition;
import org.qwed.utils.Rational;

import java.math.BigDecimal;
import java.util.Objects;

@Getter
public final class RealLiteral extends Atom {

    private final BigDecimal value;

    public RealLiteral(BigDecimal value, SourcePosition position, int nodeId) {
        super(position, nodeId);
        this.value = Objects.requireNonNull(value, "value cannot be null");
    }

    public Rational toRational() {
        return Rational.valueOf(value);
    }

    @Override
    public String toSExpression() {
        return value.toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        // 2.50 与 2.5 视为同一字面量
        return value.compareTo(((RealLiteral) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }
}
