package org.qwed.errors;

/**
 * 编译期错误。输入是静态的，因此从不重试。
 */
public abstract class CompileException extends VerificationException {

    protected CompileException(String code, String message, SourcePosition position) {
        super(ErrorCategory.COMPILE, code, message, position);
    }
}
