package org.qwed.parser;

import org.qwed.core.VerificationConfig;
import org.qwed.errors.InputTooLargeException;
import org.qwed.errors.ParseException;
import org.qwed.errors.SourcePosition;
import org.qwed.errors.UnknownOperatorException;
import org.qwed.errors.ValidationException;
import org.qwed.errors.ValidationFailure;
import org.qwed.expressions.BoolLiteral;
import org.qwed.expressions.Compound;
import org.qwed.expressions.Expression;
import org.qwed.expressions.IntLiteral;
import org.qwed.expressions.OperatorKind;
import org.qwed.expressions.RealLiteral;
import org.qwed.expressions.StringLiteral;
import org.qwed.expressions.Variable;
import org.qwed.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 递归下降解析器，文法为 expr := atom | "(" operator expr* ")"。
 * 解析器只构造语法树，不具备任何执行能力。嵌套深度在下降过程中即时检查，
 * 恶意的深层嵌套不会耗尽调用栈。
 * 此类是无状态的，可以在线程间共享。
 */
public final class SExpressionParser {

    private static final Logger logger = LoggerFactory.getLogger(SExpressionParser.class);

    private static final Pattern NUMBER = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}0-9_.]*");
    private static final String EXPECTED_OPERAND = "operand";

    private final int maxInputBytes;
    private final int maxDepth;

    public SExpressionParser(int maxInputBytes, int maxDepth) {
        if (maxInputBytes <= 0 || maxDepth <= 0) {
            throw new IllegalArgumentException("maxInputBytes 与 maxDepth 必须为正数");
        }
        this.maxInputBytes = maxInputBytes;
        this.maxDepth = maxDepth;
    }

    public static SExpressionParser fromConfig(VerificationConfig config) {
        return new SExpressionParser(config.getMaxInputBytes(), config.getMaxDepth());
    }

    /**
     * 解析一个完整的表达式。
     * @param source 输入文本（UTF-8 语义下计算长度）。
     * @return 语法树根节点。
     * @throws InputTooLargeException 输入超过长度上限。
     * @throws ParseException 语法错误，包括括号不匹配和多余的输入。
     * @throws UnknownOperatorException 运算符位置出现白名单外的名字。
     * @throws ValidationException 嵌套深度超过上限（DEPTH_EXCEEDED）。
     */
    public Expression parse(String source) {
        if (source == null) {
            throw new ParseException(SourcePosition.START, "expression", ParseException.END_OF_INPUT);
        }
        int bytes = source.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > maxInputBytes) {
            logger.warn("拒绝过长输入: {} 字节 > {} 字节", bytes, maxInputBytes);
            throw new InputTooLargeException(bytes, maxInputBytes);
        }
        Cursor cursor = new Cursor(SExpressionLexer.tokenize(source));
        if (cursor.peek().getType() == TokenType.EOF) {
            throw new ParseException(cursor.peek().getPosition(), "expression", ParseException.END_OF_INPUT);
        }
        Expression root = parseExpression(cursor, 1);
        Token trailing = cursor.peek();
        if (trailing.getType() != TokenType.EOF) {
            throw new ParseException(trailing.getPosition(), ParseException.END_OF_INPUT, trailing.describe());
        }
        logger.debug("解析完成: {} 个节点, 深度 {}", root.size(), root.depth());
        return root;
    }

    /**
     * 按同一套数字文法解析单独出现的数字，例如算术声称值。结果不会拼接进表达式文本。
     * @throws ParseException 不符合数字文法或整数越界时抛出。
     */
    public Rational parseNumber(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.length() > maxInputBytes) {
            throw new InputTooLargeException(trimmed.length(), maxInputBytes);
        }
        if (!NUMBER.matcher(trimmed).matches()) {
            throw new ParseException(SourcePosition.START, "number",
                    trimmed.isEmpty() ? ParseException.END_OF_INPUT : "'" + trimmed + "'");
        }
        Expression literal = numberLiteral(new Token(TokenType.WORD, trimmed, SourcePosition.START), 0);
        if (literal instanceof IntLiteral intLiteral) {
            return intLiteral.toRational();
        }
        return ((RealLiteral) literal).toRational();
    }

    private Expression parseExpression(Cursor cursor, int level) {
        Token token = cursor.peek();
        if (level > maxDepth) {
            logger.warn("嵌套深度超过上限 {} @{}", maxDepth, token.getPosition());
            throw new ValidationException(ValidationFailure.DEPTH_EXCEEDED, token.getPosition(),
                    "嵌套深度超过上限 " + maxDepth);
        }
        return switch (token.getType()) {
            case LPAREN -> parseCompound(cursor, level);
            case RPAREN, EOF -> throw new ParseException(token.getPosition(), EXPECTED_OPERAND, token.describe());
            case STRING -> {
                cursor.next();
                yield new StringLiteral(token.getText(), token.getPosition(), cursor.nextId());
            }
            case WORD -> {
                cursor.next();
                yield parseAtom(token, cursor.nextId());
            }
        };
    }

    private Compound parseCompound(Cursor cursor, int level) {
        Token open = cursor.next();
        int nodeId = cursor.nextId();
        Token head = cursor.next();
        if (head.getType() != TokenType.WORD) {
            throw new ParseException(head.getPosition(), "operator", head.describe());
        }
        OperatorKind operator = OperatorKind.lookup(head.getText())
                .orElseThrow(() -> unknownOperator(head));

        List<Expression> operands = new ArrayList<>();
        while (cursor.peek().getType() != TokenType.RPAREN) {
            if (cursor.peek().getType() == TokenType.EOF) {
                throw new ParseException(cursor.peek().getPosition(), "')'", ParseException.END_OF_INPUT);
            }
            operands.add(parseExpression(cursor, level + 1));
        }
        cursor.next(); // ')'
        return new Compound(operator, operands, open.getPosition(), nodeId);
    }

    private RuntimeException unknownOperator(Token head) {
        if (looksNumeric(head.getText())) {
            return new ParseException(head.getPosition(), "operator", head.describe());
        }
        logger.warn("未知运算符 @{}", head.getPosition());
        return new UnknownOperatorException(head.getText(), head.getPosition());
    }

    private Expression parseAtom(Token token, int nodeId) {
        String text = token.getText();
        if (looksNumeric(text)) {
            if (!NUMBER.matcher(text).matches()) {
                throw new ParseException(token.getPosition(), "number", token.describe());
            }
            return numberLiteral(token, nodeId);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return new BoolLiteral(lower.equals("true"), token.getPosition(), nodeId);
        }
        if (!IDENTIFIER.matcher(text).matches() || OperatorKind.isKeyword(text)) {
            // 运算符名和符号不能出现在操作数位置
            throw new ParseException(token.getPosition(), EXPECTED_OPERAND, token.describe());
        }
        return new Variable(text, token.getPosition(), nodeId);
    }

    private static Expression numberLiteral(Token token, int nodeId) {
        String text = token.getText();
        if (text.indexOf('.') >= 0) {
            return new RealLiteral(new BigDecimal(text), token.getPosition(), nodeId);
        }
        try {
            return new IntLiteral(Long.parseLong(text), token.getPosition(), nodeId);
        } catch (NumberFormatException e) {
            throw new ParseException(token.getPosition(), "64-bit integer", token.describe());
        }
    }

    /**
     * 以数字开头，或以 '-' 后接数字/'-' 开头的单词都按数字处理，例如 5abc、1.、--1 均为语法错误。
     */
    private static boolean looksNumeric(String text) {
        if (text.isEmpty()) {
            return false;
        }
        char first = text.charAt(0);
        if (first >= '0' && first <= '9') {
            return true;
        }
        if (first == '-' && text.length() > 1) {
            char second = text.charAt(1);
            return (second >= '0' && second <= '9') || second == '-' || second == '.';
        }
        return false;
    }

    /**
     * 单次解析的游标。节点编号按前序分配。
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int index = 0;
        private int nodeCounter = 0;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (token.getType() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        int nextId() {
            return nodeCounter++;
        }
    }
}
