package org.qwed.errors;

public final class DivisionByZeroException extends CompileException {

    public DivisionByZeroException(SourcePosition position) {
        super("DIVISION_BY_ZERO", "除数为字面量零 @" + position, position);
    }
}
