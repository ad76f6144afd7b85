package org.qwed.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 比较关系。编译器和精确求值器共用同一份语义，保证两个引擎对同一比较给出一致的真值。
 */
public enum RelationType {

    /**
     * 运算符枚举
     */
    EQ("="),    // Equal
    NE("!="),   // Not Equal
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">=");   // Greater Equal

    private static final Logger logger = LoggerFactory.getLogger(RelationType.class);

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 比较运算符到关系类型的映射。
     * @param operator 比较类运算符。
     * @return 对应的关系类型。
     * @throws IllegalArgumentException 如果 operator 不是比较运算符。
     */
    public static RelationType of(OperatorKind operator) {
        return switch (operator) {
            case EQ -> EQ;
            case NE -> NE;
            case LT -> LT;
            case LE -> LE;
            case GT -> GT;
            case GE -> GE;
            default -> {
                logger.error("RelationType.of: {} 不是比较运算符", operator);
                throw new IllegalArgumentException("不是比较运算符: " + operator);
            }
        };
    }

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。
     */
    public RelationType negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
        };
    }

    /**
     * 根据 compareTo 的结果判断关系是否成立。
     * @param comparison left.compareTo(right) 的结果。
     */
    public boolean holds(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
        };
    }

    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    /**
     * 构造对应的 Z3 布尔项。EQ/NE 适用于任意同类项，其余只适用于算术项。
     */
    public BoolExpr toZ3BoolExpr(Context ctx, Expr left, Expr right) {
        return switch (this) {
            case EQ -> ctx.mkEq(left, right);
            case NE -> ctx.mkDistinct(left, right);
            case LT -> ctx.mkLt((ArithExpr) left, (ArithExpr) right);
            case LE -> ctx.mkLe((ArithExpr) left, (ArithExpr) right);
            case GT -> ctx.mkGt((ArithExpr) left, (ArithExpr) right);
            case GE -> ctx.mkGe((ArithExpr) left, (ArithExpr) right);
        };
    }
}
