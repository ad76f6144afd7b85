package org.qwed.engine.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * 识别引号与注释的 SQL 词法分析。字符串内容不会被当作关键字，注释作为独立的词法单元保留。
 */
final class SqlTokenizer {

    /**
     * 字符串、引号标识符或块注释未闭合。
     */
    static final class UnterminatedException extends RuntimeException {
        private final int offset;

        UnterminatedException(String what, int offset) {
            super("未闭合的" + what + " @" + offset);
            this.offset = offset;
        }

        int getOffset() {
            return offset;
        }
    }

    private static final String OPERATOR_CHARS = "=<>!+-*/%|&^~";

    private SqlTokenizer() {
    }

    static List<SqlToken> tokenize(String sql) {
        List<SqlToken> tokens = new ArrayList<>();
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char ch = sql.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if ((ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') || ch == '#') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? n : end;
                tokens.add(new SqlToken(SqlToken.Kind.COMMENT, sql.substring(i, end), i));
                i = end;
            } else if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new UnterminatedException("块注释", i);
                }
                tokens.add(new SqlToken(SqlToken.Kind.COMMENT, sql.substring(i, end + 2), i));
                i = end + 2;
            } else if (ch == '\'') {
                i = quoted(sql, i, '\'', SqlToken.Kind.STRING, tokens);
            } else if (ch == '"' || ch == '`') {
                i = quoted(sql, i, ch, SqlToken.Kind.QUOTED_IDENTIFIER, tokens);
            } else if (Character.isDigit(ch)) {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new SqlToken(SqlToken.Kind.NUMBER, sql.substring(start, i), start));
            } else if (Character.isLetter(ch) || ch == '_' || ch == '@' || ch == '$') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_'
                        || sql.charAt(i) == '$' || sql.charAt(i) == '@')) {
                    i++;
                }
                tokens.add(new SqlToken(SqlToken.Kind.WORD, sql.substring(start, i), start));
            } else if (OPERATOR_CHARS.indexOf(ch) >= 0) {
                int start = i;
                while (i < n && OPERATOR_CHARS.indexOf(sql.charAt(i)) >= 0
                        && !(sql.charAt(i) == '-' && i + 1 < n && sql.charAt(i + 1) == '-')
                        && !(sql.charAt(i) == '/' && i + 1 < n && sql.charAt(i + 1) == '*')) {
                    i++;
                }
                tokens.add(new SqlToken(SqlToken.Kind.OPERATOR, sql.substring(start, i), start));
            } else {
                tokens.add(new SqlToken(SqlToken.Kind.PUNCTUATION, String.valueOf(ch), i));
                i++;
            }
        }
        return tokens;
    }

    /**
     * 读取引号包围的内容，连续两个引号表示引号本身。
     * @return 结束引号之后的位置。
     */
    private static int quoted(String sql, int start, char quote, SqlToken.Kind kind, List<SqlToken> tokens) {
        StringBuilder buf = new StringBuilder();
        int i = start + 1;
        while (i < sql.length()) {
            char ch = sql.charAt(i);
            if (ch == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    buf.append(quote);
                    i += 2;
                    continue;
                }
                tokens.add(new SqlToken(kind, buf.toString(), start));
                return i + 1;
            }
            if (ch == '\\' && quote == '\'' && i + 1 < sql.length()) {
                buf.append(sql.charAt(i + 1));
                i += 2;
                continue;
            }
            buf.append(ch);
            i++;
        }
        throw new UnterminatedException(kind == SqlToken.Kind.STRING ? "字符串" : "引号标识符", start);
    }
}
