package org.qwed.validation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.qwed.expressions.Expression;

import java.util.Objects;

/**
 * 通过校验的语法树。只有 {@link AstValidator} 能构造，编译器只接受此类型。
 */
@Getter
@EqualsAndHashCode
public final class ValidatedExpression {

    private final Expression root;
    private final TypeEnvironment types;
    private final RootKind rootKind;

    ValidatedExpression(Expression root, TypeEnvironment types, RootKind rootKind) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.types = Objects.requireNonNull(types, "types cannot be null");
        this.rootKind = Objects.requireNonNull(rootKind, "rootKind cannot be null");
    }

    public ValueSort rootSort() {
        return types.sortOf(root);
    }

    @Override
    public String toString() {
        return root.toSExpression();
    }
}
