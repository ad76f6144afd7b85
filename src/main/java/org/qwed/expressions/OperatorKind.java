package org.qwed.expressions;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 约束语言的封闭运算符表。
 * 元数规则在这里定义，校验器和编译器都只读这张表；编译器对本枚举做穷尽 switch，
 * 因此新增运算符必然是一次编译期可见的改动。
 */
@Getter
public enum OperatorKind {

    // 逻辑
    AND(OperatorCategory.LOGICAL, 1, Arity.VARIADIC, "&&"),
    OR(OperatorCategory.LOGICAL, 1, Arity.VARIADIC, "||"),
    NOT(OperatorCategory.LOGICAL, 1, 1, "!"),
    IMPLIES(OperatorCategory.LOGICAL, 2, 2, "=>"),
    IFF(OperatorCategory.LOGICAL, 2, 2, "<=>"),
    XOR(OperatorCategory.LOGICAL, 2, 2),

    // 比较
    EQ(OperatorCategory.COMPARISON, 2, 2, "=", "=="),
    NE(OperatorCategory.COMPARISON, 2, 2, "!="),
    GT(OperatorCategory.COMPARISON, 2, 2, ">"),
    GE(OperatorCategory.COMPARISON, 2, 2, ">="),
    LT(OperatorCategory.COMPARISON, 2, 2, "<"),
    LE(OperatorCategory.COMPARISON, 2, 2, "<="),

    // 算术
    PLUS(OperatorCategory.ARITHMETIC, 1, Arity.VARIADIC, "+"),
    MINUS(OperatorCategory.ARITHMETIC, 1, Arity.VARIADIC, "-"),
    MULT(OperatorCategory.ARITHMETIC, 1, Arity.VARIADIC, "*"),
    DIV(OperatorCategory.ARITHMETIC, 2, 2, "/"),
    MOD(OperatorCategory.ARITHMETIC, 2, 2, "%"),
    POW(OperatorCategory.ARITHMETIC, 2, 2, "^"),
    ABS(OperatorCategory.ARITHMETIC, 1, 1),
    NEG(OperatorCategory.ARITHMETIC, 1, 1),

    // 量词：(FORALL x body)
    FORALL(OperatorCategory.QUANTIFIER, 2, 2),
    EXISTS(OperatorCategory.QUANTIFIER, 2, 2),

    // 集合
    LEN(OperatorCategory.COLLECTION, 1, 1),
    GET(OperatorCategory.COLLECTION, 2, 2),
    SET(OperatorCategory.COLLECTION, 3, 3),
    SUM(OperatorCategory.COLLECTION, 2, 2);

    private static final Map<String, OperatorKind> BY_NAME;

    static {
        Map<String, OperatorKind> byName = new HashMap<>();
        for (OperatorKind kind : values()) {
            byName.put(kind.name(), kind);
            for (String alias : kind.aliases) {
                byName.put(alias, kind);
            }
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final OperatorCategory category;
    private final Arity arity;
    private final List<String> aliases;

    OperatorKind(OperatorCategory category, int minOperands, int maxOperands, String... aliases) {
        this.category = category;
        this.arity = Arity.of(minOperands, maxOperands);
        this.aliases = List.of(aliases);
    }

    /**
     * 按关键字（大小写不敏感）或符号别名查找运算符。
     * @param token 运算符位置上的词法单元。
     * @return 对应的运算符；不在表中时为空。
     */
    public static Optional<OperatorKind> lookup(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        OperatorKind byAlias = BY_NAME.get(token);
        if (byAlias != null) {
            return Optional.of(byAlias);
        }
        return Optional.ofNullable(BY_NAME.get(token.toUpperCase(Locale.ROOT)));
    }

    /**
     * 只判断关键字，不含符号别名。用于拒绝把运算符名当作变量名。
     */
    public static boolean isKeyword(String word) {
        try {
            valueOf(word.toUpperCase(Locale.ROOT));
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public boolean isQuantifier() {
        return category == OperatorCategory.QUANTIFIER;
    }
}
