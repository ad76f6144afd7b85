package org.qwed.symbolic;

/**
 * 外部求解器的边界。子系统只依赖 Sat/Unsat/Unknown 这一三路契约，底层求解器可以替换。
 */
public interface SolverAdapter {

    SolverSession openSession();
}
