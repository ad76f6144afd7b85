package org.qwed.resilience;

public enum CircuitState {
    /** 正常放行，失败记录在滑动窗口中。 */
    CLOSED,
    /** 直接短路，不调用引擎。 */
    OPEN,
    /** 冷却结束，只放行一次探测调用。 */
    HALF_OPEN
}
