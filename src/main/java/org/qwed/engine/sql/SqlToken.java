package org.qwed.engine.sql;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;

@Getter
@EqualsAndHashCode
final class SqlToken {

    enum Kind {
        WORD,
        QUOTED_IDENTIFIER,
        STRING,
        NUMBER,
        OPERATOR,
        PUNCTUATION,
        COMMENT
    }

    private final Kind kind;
    private final String text;
    private final int offset;

    SqlToken(Kind kind, String text, int offset) {
        this.kind = kind;
        this.text = text;
        this.offset = offset;
    }

    /**
     * 关键字和未加引号的标识符大小写不敏感。
     */
    String normalized() {
        return kind == Kind.WORD ? text.toUpperCase(Locale.ROOT) : text;
    }

    boolean is(Kind expected, String value) {
        return kind == expected && normalized().equals(value);
    }

    boolean isLiteral() {
        return kind == Kind.STRING || kind == Kind.NUMBER;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")";
    }
}
