package org.qwed.validation;

/**
 * 对根节点的期望：逻辑约束要求布尔根，算术表达式要求数值根。
 */
public enum RootKind {
    FORMULA,
    TERM
}
