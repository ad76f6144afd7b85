package org.qwed.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.qwed.errors.ErrorCategory;
import org.qwed.errors.SourcePosition;
import org.qwed.errors.VerificationException;

import java.util.Objects;
import java.util.Optional;

/**
 * 引擎未能给出判定时的原因。熔断和超时没有错误分类。
 */
@Getter
@EqualsAndHashCode
public final class FailureDetail implements EngineDetail {

    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";
    public static final String ENGINE_TIMEOUT = "ENGINE_TIMEOUT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final ErrorCategory category;
    private final String code;
    private final String message;
    private final SourcePosition position;

    private FailureDetail(ErrorCategory category, String code, String message, SourcePosition position) {
        this.category = category;
        this.code = Objects.requireNonNull(code, "code cannot be null");
        this.message = Objects.requireNonNull(message, "message cannot be null");
        this.position = position;
    }

    public static FailureDetail of(VerificationException e) {
        return new FailureDetail(e.getCategory(), e.getCode(), e.getMessage(), e.getPosition());
    }

    public static FailureDetail circuitOpen() {
        return new FailureDetail(null, CIRCUIT_OPEN, "circuit open", null);
    }

    public static FailureDetail timeout(long deadlineMillis) {
        return new FailureDetail(null, ENGINE_TIMEOUT, "no result within " + deadlineMillis + "ms", null);
    }

    public static FailureDetail internal(Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new FailureDetail(null, INTERNAL_ERROR, message, null);
    }

    public Optional<ErrorCategory> getCategory() {
        return Optional.ofNullable(category);
    }

    public Optional<SourcePosition> getPosition() {
        return Optional.ofNullable(position);
    }

    @Override
    public String summary() {
        return code + ": " + message;
    }

    @Override
    public String toString() {
        return summary();
    }
}
