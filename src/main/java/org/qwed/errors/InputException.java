package org.qwed.errors;

/**
 * 输入错误：总是带位置信息报告给调用方，从不重试。
 */
public abstract class InputException extends VerificationException {

    protected InputException(String code, String message, SourcePosition position) {
        super(ErrorCategory.INPUT, code, message, position);
    }
}
