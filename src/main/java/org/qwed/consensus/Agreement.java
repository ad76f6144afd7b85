package org.qwed.consensus;

public enum Agreement {
    /** 所有有响应的引擎给出同一状态。 */
    UNANIMOUS,
    /** 领先状态的加权份额达到阈值。 */
    MAJORITY,
    /** 其余情况，包括平局。 */
    SPLIT
}
