package org.qwed.errors;

import lombok.Getter;

import java.util.Map;

@Getter
public final class SolverTimeoutException extends SolverException {

    private final long timeoutMillis;

    public SolverTimeoutException(long timeoutMillis) {
        super("SOLVER_TIMEOUT", "求解器在 " + timeoutMillis + "ms 内未给出结果", null);
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    protected void addDetails(Map<String, Object> details) {
        details.put("timeoutMillis", timeoutMillis);
    }
}
