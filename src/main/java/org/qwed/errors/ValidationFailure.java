package org.qwed.errors;

public enum ValidationFailure {
    ARITY_MISMATCH,
    DEPTH_EXCEEDED,
    NODE_COUNT_EXCEEDED,
    TYPE_CONFLICT,
    BINDER_CONFLICT,
    INVALID_BINDER
}
