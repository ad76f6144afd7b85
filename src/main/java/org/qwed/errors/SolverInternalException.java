package org.qwed.errors;

public final class SolverInternalException extends SolverException {

    public SolverInternalException(String message, Throwable cause) {
        super("SOLVER_INTERNAL_ERROR", message, cause);
    }
}
