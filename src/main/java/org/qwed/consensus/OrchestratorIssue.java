package org.qwed.consensus;

/**
 * 编排层的问题。从不抛出，只附在降级的判定上。
 */
public enum OrchestratorIssue {
    /** 至少一个引擎在请求截止时间前没有返回。 */
    REQUEST_DEADLINE_EXCEEDED,
    /** 没有引擎适用于该产物。 */
    NO_APPLICABLE_ENGINE
}
