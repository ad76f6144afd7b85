package org.qwed.expressions;

import lombok.Getter;
import org.qwed.errors.SourcePosition;

import java.util.Objects;

@Getter
public final class Variable extends Atom {

    private final String name;

    public Variable(String name, SourcePosition position, int nodeId) {
        super(position, nodeId);
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    @Override
    public String toSExpression() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("var", name);
    }
}
