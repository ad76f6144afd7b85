package org.qwed.validation;

/**
 * 推断得到的取值类别。数组一律以整数为下标。
 */
public enum ValueSort {
    BOOL,
    INT,
    REAL,
    STRING,
    INT_ARRAY,
    REAL_ARRAY;

    public boolean isNumeric() {
        return this == INT || this == REAL;
    }

    public boolean isArray() {
        return this == INT_ARRAY || this == REAL_ARRAY;
    }

    /**
     * 数组的元素类别。
     * @throws IllegalStateException 非数组类别调用时抛出。
     */
    public ValueSort elementSort() {
        return switch (this) {
            case INT_ARRAY -> INT;
            case REAL_ARRAY -> REAL;
            default -> throw new IllegalStateException(this + " 不是数组类别");
        };
    }
}
