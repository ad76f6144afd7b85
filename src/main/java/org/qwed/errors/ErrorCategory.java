package org.qwed.errors;

/**
 * 错误分类。决定一个失败是否重试、是否计入熔断器。
 */
public enum ErrorCategory {
    /** 输入过长、语法错误、未知运算符、元数/深度/节点数/类型不合法。不重试。 */
    INPUT,
    /** 除零、不支持的构造、指数过大。输入是静态的，重试只会得到同样的失败。 */
    COMPILE,
    /** 求解器超时或内部错误。由引擎调用包装器重试一次。 */
    SOLVER
}
