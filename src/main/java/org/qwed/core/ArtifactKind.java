package org.qwed.core;

/**
 * 模型翻译出的结构化产物的种类。
 */
public enum ArtifactKind {
    /** S 表达式约束，由逻辑引擎求解。 */
    LOGIC,
    /** 算术表达式 + 声称的结果值。 */
    ARITHMETIC,
    /** 单条 SQL 语句。 */
    SQL,
    /** 代码片段（Python）。 */
    CODE
}
