package org.qwed.expressions;

import lombok.Getter;
import org.qwed.errors.SourcePosition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 复合节点 (operator operand...)。
 * 构造时不检查元数：解析器只负责结构，元数由校验器统一拒绝。
 */
@Getter
public final class Compound extends Expression {

    private final OperatorKind operator;
    private final List<Expression> operands;
    private final int depth;
    private final int size;

    public Compound(OperatorKind operator, List<Expression> operands, SourcePosition position, int nodeId) {
        super(position, nodeId);
        this.operator = Objects.requireNonNull(operator, "operator cannot be null");
        this.operands = List.copyOf(Objects.requireNonNull(operands, "operands cannot be null"));
        int maxChildDepth = 0;
        int totalSize = 1;
        for (Expression operand : this.operands) {
            maxChildDepth = Math.max(maxChildDepth, operand.depth());
            totalSize += operand.size();
        }
        this.depth = maxChildDepth + 1;
        this.size = totalSize;
    }

    public Expression operand(int index) {
        return operands.get(index);
    }

    public int arity() {
        return operands.size();
    }

    @Override
    public int depth() {
        return depth;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public String toSExpression() {
        if (operands.isEmpty()) {
            return "(" + operator.name() + ")";
        }
        return "(" + operator.name() + " "
                + operands.stream().map(Expression::toSExpression).collect(Collectors.joining(" "))
                + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Compound that = (Compound) o;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands);
    }
}
