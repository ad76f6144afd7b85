package org.qwed.expressions;

import lombok.Getter;
import org.qwed.errors.SourcePosition;

@Getter
public final class BoolLiteral extends Atom {

    private final boolean value;

    public BoolLiteral(boolean value, SourcePosition position, int nodeId) {
        super(position, nodeId);
        this.value = value;
    }

    @Override
    public String toSExpression() {
        return value ? "true" : "false";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((BoolLiteral) o).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
