package org.qwed.expressions;

import lombok.Getter;
import org.qwed.errors.SourcePosition;

import java.util.Objects;

@Getter
public final class StringLiteral extends Atom {

    private final String value;

    public StringLiteral(String value, SourcePosition position, int nodeId) {
        super(position, nodeId);
        this.value = Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String toSExpression() {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((StringLiteral) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("str", value);
    }
}
