package org.qwed.parser;

import lombok.Getter;
import org.qwed.errors.ParseException;
import org.qwed.errors.SourcePosition;

import java.util.Objects;

@Getter
public final class Token {

    private final TokenType type;
    private final String text;
    private final SourcePosition position;

    public Token(TokenType type, String text, SourcePosition position) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.position = Objects.requireNonNull(position, "position cannot be null");
    }

    /**
     * 用于错误信息的描述。字符串内容可能很长，只给出类型。
     */
    public String describe() {
        return switch (type) {
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            case STRING -> "string literal";
            case WORD -> "'" + text + "'";
            case EOF -> ParseException.END_OF_INPUT;
        };
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
