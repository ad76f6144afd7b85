package org.qwed.errors;

import lombok.Getter;

import java.util.Map;

@Getter
public final class ExponentTooLargeException extends CompileException {

    private final long exponent;
    private final int maxExponent;

    public ExponentTooLargeException(long exponent, int maxExponent, SourcePosition position) {
        super("EXPONENT_TOO_LARGE", "指数 " + exponent + " 超过上限 " + maxExponent + " @" + position, position);
        this.exponent = exponent;
        this.maxExponent = maxExponent;
    }

    @Override
    protected void addDetails(Map<String, Object> details) {
        details.put("exponent", exponent);
        details.put("maxExponent", maxExponent);
    }
}
