package org.qwed.resilience;

import lombok.Getter;

/**
 * 一次获准的调用。调用结束后必须通过 onSuccess / onFailure / onCancelled 之一归还。
 * generation 用于丢弃状态切换之前发出的调用的迟到结果。
 */
@Getter
public final class CallPermit {

    private final long generation;
    private final boolean probe;

    CallPermit(long generation, boolean probe) {
        this.generation = generation;
        this.probe = probe;
    }

    @Override
    public String toString() {
        return "CallPermit(" + generation + (probe ? ", probe" : "") + ")";
    }
}
