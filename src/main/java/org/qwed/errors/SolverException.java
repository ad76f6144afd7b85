package org.qwed.errors;

/**
 * 外部求解器失败。视为瞬时基础设施故障，调用包装器会原样重试一次。
 */
public abstract class SolverException extends VerificationException {

    protected SolverException(String code, String message, Throwable cause) {
        super(ErrorCategory.SOLVER, code, message, null, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
