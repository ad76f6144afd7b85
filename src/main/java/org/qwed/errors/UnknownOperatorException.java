package org.qwed.errors;

import lombok.Getter;

import java.util.Map;

/**
 * 运算符位置出现了白名单之外的名字。此类名字绝不会被当作变量处理。
 */
@Getter
public final class UnknownOperatorException extends InputException {

    private final String name;

    public UnknownOperatorException(String name, SourcePosition position) {
        super("UNKNOWN_OPERATOR", "未知运算符 '" + name + "' @" + position, position);
        this.name = name;
    }

    @Override
    protected void addDetails(Map<String, Object> details) {
        details.put("operator", name);
    }
}
