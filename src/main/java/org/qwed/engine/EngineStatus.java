package org.qwed.engine;

public enum EngineStatus {
    VERIFIED,
    FAILED,
    /** 发现安全问题，一票否决。 */
    BLOCKED,
    ERROR,
    /** 请求截止时间前未返回。不计入投票。 */
    TIMEOUT
}
