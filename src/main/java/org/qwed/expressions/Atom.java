package org.qwed.expressions;

import org.qwed.errors.SourcePosition;

/**
 * 叶子节点：变量或字面量。
 */
public abstract class Atom extends Expression {

    protected Atom(SourcePosition position, int nodeId) {
        super(position, nodeId);
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public int size() {
        return 1;
    }
}
