package org.qwed.errors;

import lombok.Getter;

import java.util.Map;

/**
 * 语法错误：在 position 处期望 expected，实际读到 found。
 */
@Getter
public final class ParseException extends InputException {

    public static final String END_OF_INPUT = "<end of input>";

    private final String expected;
    private final String found;

    public ParseException(SourcePosition position, String expected, String found) {
        super("PARSE_ERROR", "语法错误 @" + position + ": 期望 " + expected + "，实际为 " + found, position);
        this.expected = expected;
        this.found = found;
    }

    @Override
    protected void addDetails(Map<String, Object> details) {
        details.put("expected", expected);
        details.put("found", found);
    }
}
