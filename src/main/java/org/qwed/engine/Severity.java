package org.qwed.engine;

public enum Severity {
    /** 直接阻断。 */
    CRITICAL,
    /** 需要人工复核。 */
    WARNING
}
