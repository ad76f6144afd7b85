package org.qwed.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * 单个引擎的一次判定。生成后不再修改；延迟由调用包装器填写。
 */
@Getter
@EqualsAndHashCode
public final class EngineResult {

    private final String engineId;
    private final EngineStatus status;
    private final double confidence;
    private final EngineDetail detail;
    private final long latencyMillis;

    private EngineResult(String engineId, EngineStatus status, double confidence, EngineDetail detail, long latencyMillis) {
        this.engineId = Objects.requireNonNull(engineId, "engineId cannot be null");
        this.status = Objects.requireNonNull(status, "status cannot be null");
        Validate.inclusiveBetween(0.0, 1.0, confidence, "confidence must be in [0, 1]: %s", confidence);
        this.confidence = confidence;
        this.detail = Objects.requireNonNull(detail, "detail cannot be null");
        Validate.isTrue(latencyMillis >= 0, "latencyMillis cannot be negative: %d", latencyMillis);
        this.latencyMillis = latencyMillis;
    }

    public static EngineResult of(String engineId, EngineStatus status, double confidence, EngineDetail detail) {
        return new EngineResult(engineId, status, confidence, detail, 0L);
    }

    public static EngineResult verified(String engineId, double confidence, EngineDetail detail) {
        return of(engineId, EngineStatus.VERIFIED, confidence, detail);
    }

    public static EngineResult failed(String engineId, double confidence, EngineDetail detail) {
        return of(engineId, EngineStatus.FAILED, confidence, detail);
    }

    public static EngineResult blocked(String engineId, EngineDetail detail) {
        return of(engineId, EngineStatus.BLOCKED, 1.0, detail);
    }

    public static EngineResult error(String engineId, FailureDetail detail) {
        return of(engineId, EngineStatus.ERROR, 0.0, detail);
    }

    public static EngineResult timeout(String engineId, long deadlineMillis) {
        return of(engineId, EngineStatus.TIMEOUT, 0.0, FailureDetail.timeout(deadlineMillis));
    }

    public EngineResult withLatency(long latencyMillis) {
        return new EngineResult(engineId, status, confidence, detail, latencyMillis);
    }

    @Override
    public String toString() {
        return engineId + "=" + status + "(" + confidence + ", " + detail.summary() + ", " + latencyMillis + "ms)";
    }
}
