package org.qwed.expressions;

import lombok.Getter;
import org.qwed.errors.SourcePosition;
import org.qwed.utils.Rational;

@Getter
public final class IntLiteral extends Atom {

    private final long value;

    public IntLiteral(long value, SourcePosition position, int nodeId) {
        super(position, nodeId);
        this.value = value;
    }

    public Rational toRational() {
        return Rational.valueOf(value);
    }

    @Override
    public String toSExpression() {
        return Long.toString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((IntLiteral) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
