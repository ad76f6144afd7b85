package org.qwed.core;

import lombok.Getter;

/**
 * 验证强度，对应参与投票的引擎数量。
 */
@Getter
public enum VerificationMode {
    SINGLE(1),
    HIGH(2),
    MAXIMUM(Integer.MAX_VALUE);

    private final int engineCount;

    VerificationMode(int engineCount) {
        this.engineCount = engineCount;
    }
}
