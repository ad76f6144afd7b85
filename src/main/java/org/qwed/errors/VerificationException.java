package org.qwed.errors;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 验证子系统所有异常的基类。
 * 每个异常携带分类、稳定的错误码以及（若有）出错位置，供调用方渲染为结构化错误。
 */
@Getter
public abstract class VerificationException extends RuntimeException {

    private final ErrorCategory category;
    private final String code;
    private final SourcePosition position;

    protected VerificationException(ErrorCategory category, String code, String message, SourcePosition position) {
        this(category, code, message, position, null);
    }

    protected VerificationException(ErrorCategory category, String code, String message,
                                    SourcePosition position, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category cannot be null");
        this.code = Objects.requireNonNull(code, "code cannot be null");
        this.position = position;
    }

    /**
     * @return 此类错误是否值得不改参数地重试一次。
     */
    public boolean isRetryable() {
        return false;
    }

    /**
     * 结构化的错误详情，键的顺序固定。
     */
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", code);
        details.put("category", category.name());
        details.put("message", getMessage());
        if (position != null) {
            details.put("line", position.getLine());
            details.put("column", position.getColumn());
            details.put("offset", position.getOffset());
        }
        addDetails(details);
        return Collections.unmodifiableMap(details);
    }

    /**
     * 子类追加特有字段。
     */
    protected void addDetails(Map<String, Object> details) {
    }
}
