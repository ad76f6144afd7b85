package org.qwed.symbolic;

import org.qwed.compiler.CompiledConstraint;

/**
 * 一次请求独占的求解会话。会话持有编译所需的变量管理器，关闭时释放底层资源。
 * 会话不是线程安全的。
 */
public interface SolverSession extends AutoCloseable {

    Z3VariableManager variables();

    /**
     * 求解一组约束。
     * @param constraint 在本会话中编译的约束。
     * @return Sat(model) / Unsat / Unknown。
     * @throws org.qwed.errors.SolverTimeoutException 超时。
     * @throws org.qwed.errors.SolverInternalException 求解器内部错误。
     */
    SolverOutcome check(CompiledConstraint constraint);

    @Override
    void close();
}
