package org.qwed.errors;

import lombok.Getter;

import java.util.Map;

/**
 * AST 校验失败。校验是全有或全无的，抛出此异常意味着整棵树被拒绝。
 */
@Getter
public final class ValidationException extends InputException {

    private final ValidationFailure failure;

    public ValidationException(ValidationFailure failure, SourcePosition position, String message) {
        super(failure.name(), message + " @" + position, position);
        this.failure = failure;
    }

    @Override
    protected void addDetails(Map<String, Object> details) {
        details.put("failure", failure.name());
    }
}
