package org.qwed.core;

/**
 * 逻辑产物要证明的目标。
 */
public enum LogicGoal {
    /** 存在一组赋值使约束成立；成立时返回模型。 */
    SATISFIABLE,
    /** 约束对所有赋值成立；不成立时返回反例。 */
    VALID
}
