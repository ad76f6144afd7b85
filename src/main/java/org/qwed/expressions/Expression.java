package org.qwed.expressions;

import lombok.Getter;
import org.qwed.errors.SourcePosition;

import java.util.Objects;

/**
 * 约束语言的抽象语法树节点。
 * 每个节点记录源位置和前序遍历编号（nodeId），树一经构造即不可变。
 * 相等性只看结构，不看位置和编号。
 */
@Getter
public abstract class Expression {

    private final SourcePosition position;
    private final int nodeId;

    protected Expression(SourcePosition position, int nodeId) {
        this.position = Objects.requireNonNull(position, "position cannot be null");
        if (nodeId < 0) {
            throw new IllegalArgumentException("nodeId cannot be negative: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * 以此节点为根的子树深度，叶子为 1。
     */
    public abstract int depth();

    /**
     * 以此节点为根的子树节点总数。
     */
    public abstract int size();

    /**
     * 还原为规范化的 S 表达式文本。
     */
    public abstract String toSExpression();

    @Override
    public String toString() {
        return toSExpression();
    }
}
