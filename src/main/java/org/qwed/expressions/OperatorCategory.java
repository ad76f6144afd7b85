package org.qwed.expressions;

public enum OperatorCategory {
    LOGICAL,
    COMPARISON,
    ARITHMETIC,
    QUANTIFIER,
    COLLECTION
}
