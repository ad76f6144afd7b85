package org.qwed.parser;

import org.qwed.errors.ParseException;
import org.qwed.errors.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 把输入文本切分为词法单元。只识别括号、字符串和空白分隔的单词，不解释单词的含义。
 */
public final class SExpressionLexer {

    private static final Logger logger = LoggerFactory.getLogger(SExpressionLexer.class);

    private final String source;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    private SExpressionLexer(String source) {
        this.source = source;
    }

    /**
     * @param source 输入文本。
     * @return 词法单元序列，最后一个总是 EOF。
     * @throws ParseException 字符串未闭合或包含非法转义时抛出。
     */
    public static List<Token> tokenize(String source) {
        List<Token> tokens = new SExpressionLexer(source).run();
        logger.debug("词法分析完成: {} 个词法单元", tokens.size());
        return tokens;
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (offset < source.length()) {
            char ch = source.charAt(offset);
            if (Character.isWhitespace(ch)) {
                advance();
                continue;
            }
            SourcePosition start = here();
            switch (ch) {
                case '(' -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", start));
                }
                case ')' -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", start));
                }
                case '"' -> tokens.add(readString(start));
                default -> tokens.add(readWord(start));
            }
        }
        tokens.add(new Token(TokenType.EOF, "", here()));
        return tokens;
    }

    private Token readString(SourcePosition start) {
        advance(); // 开引号
        StringBuilder buf = new StringBuilder();
        while (offset < source.length()) {
            char ch = source.charAt(offset);
            if (ch == '"') {
                advance();
                return new Token(TokenType.STRING, buf.toString(), start);
            }
            if (ch == '\\') {
                SourcePosition escapeAt = here();
                advance();
                if (offset >= source.length()) {
                    break;
                }
                char escaped = source.charAt(offset);
                if (escaped != '"' && escaped != '\\') {
                    throw new ParseException(escapeAt, "'\\\"' or '\\\\'", "'\\" + escaped + "'");
                }
                buf.append(escaped);
                advance();
                continue;
            }
            buf.append(ch);
            advance();
        }
        throw new ParseException(here(), "closing '\"'", ParseException.END_OF_INPUT);
    }

    private Token readWord(SourcePosition start) {
        int begin = offset;
        while (offset < source.length()) {
            char ch = source.charAt(offset);
            if (Character.isWhitespace(ch) || ch == '(' || ch == ')' || ch == '"') {
                break;
            }
            advance();
        }
        return new Token(TokenType.WORD, source.substring(begin, offset), start);
    }

    private void advance() {
        char ch = source.charAt(offset++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private SourcePosition here() {
        return SourcePosition.of(offset, line, column);
    }
}
