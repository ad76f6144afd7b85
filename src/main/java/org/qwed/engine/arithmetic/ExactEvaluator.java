package org.qwed.engine.arithmetic;

import org.qwed.errors.DivisionByZeroException;
import org.qwed.errors.ExponentTooLargeException;
import org.qwed.errors.UnsupportedConstructException;
import org.qwed.expressions.BoolLiteral;
import org.qwed.expressions.Compound;
import org.qwed.expressions.Expression;
import org.qwed.expressions.IntLiteral;
import org.qwed.expressions.RealLiteral;
import org.qwed.expressions.RelationType;
import org.qwed.expressions.StringLiteral;
import org.qwed.utils.Rational;
import org.qwed.validation.TypeEnvironment;
import org.qwed.validation.ValidatedExpression;
import org.qwed.validation.ValueSort;

import java.util.List;

/**
 * 对不含变量的表达式做精确求值，结果为 Boolean、Rational 或 String。
 * 除法与取模遵循 SMT-LIB：INT 类别上是欧几里得整除，REAL 类别上是精确除法，
 * 因此与逻辑引擎对同一表达式给出相同的值。
 */
final class ExactEvaluator {

    private final int maxExponent;

    ExactEvaluator(int maxExponent) {
        this.maxExponent = maxExponent;
    }

    /**
     * @return 表达式中是否只有字面量和可求值的运算符。
     */
    static boolean isGround(Expression node) {
        if (node instanceof Compound compound) {
            switch (compound.getOperator()) {
                case FORALL, EXISTS, LEN, GET, SET, SUM:
                    return false;
                default:
                    return compound.getOperands().stream().allMatch(ExactEvaluator::isGround);
            }
        }
        return node instanceof IntLiteral || node instanceof RealLiteral
                || node instanceof BoolLiteral || node instanceof StringLiteral;
    }

    Object evaluate(ValidatedExpression expression) {
        return evaluate(expression.getRoot(), expression.getTypes());
    }

    private Object evaluate(Expression node, TypeEnvironment types) {
        if (node instanceof IntLiteral literal) {
            return literal.toRational();
        }
        if (node instanceof RealLiteral literal) {
            return literal.toRational();
        }
        if (node instanceof BoolLiteral literal) {
            return literal.isValue();
        }
        if (node instanceof StringLiteral literal) {
            return literal.getValue();
        }
        if (!(node instanceof Compound compound)) {
            throw new UnsupportedConstructException("无法精确求值含变量的表达式", node.getPosition());
        }
        List<Expression> operands = compound.getOperands();
        return switch (compound.getOperator()) {
            case AND -> {
                boolean all = true;
                for (Expression operand : operands) {
                    all &= bool(operand, types);
                }
                yield all;
            }
            case OR -> {
                boolean any = false;
                for (Expression operand : operands) {
                    any |= bool(operand, types);
                }
                yield any;
            }
            case NOT -> !bool(operands.get(0), types);
            case IMPLIES -> !bool(operands.get(0), types) || bool(operands.get(1), types);
            case IFF -> bool(operands.get(0), types) == bool(operands.get(1), types);
            case XOR -> bool(operands.get(0), types) != bool(operands.get(1), types);
            case EQ -> evaluate(operands.get(0), types).equals(evaluate(operands.get(1), types));
            case NE -> !evaluate(operands.get(0), types).equals(evaluate(operands.get(1), types));
            case GT, GE, LT, LE -> RelationType.of(compound.getOperator())
                    .holds(number(operands.get(0), types).compareTo(number(operands.get(1), types)));
            case PLUS -> {
                Rational sum = Rational.ZERO;
                for (Expression operand : operands) {
                    sum = sum.add(number(operand, types));
                }
                yield sum;
            }
            case MINUS -> {
                Rational first = number(operands.get(0), types);
                if (operands.size() == 1) {
                    yield first.negate();
                }
                for (Expression operand : operands.subList(1, operands.size())) {
                    first = first.subtract(number(operand, types));
                }
                yield first;
            }
            case MULT -> {
                Rational product = Rational.ONE;
                for (Expression operand : operands) {
                    product = product.multiply(number(operand, types));
                }
                yield product;
            }
            case DIV -> {
                Rational dividend = number(operands.get(0), types);
                Rational divisor = divisor(operands.get(1), types);
                yield types.sortOf(compound) == ValueSort.INT
                        ? dividend.integerDivide(divisor)
                        : dividend.divide(divisor);
            }
            case MOD -> number(operands.get(0), types).mod(divisor(operands.get(1), types));
            case POW -> power(compound, types);
            case ABS -> number(operands.get(0), types).abs();
            case NEG -> number(operands.get(0), types).negate();
            case FORALL, EXISTS, LEN, GET, SET, SUM ->
                    throw new UnsupportedConstructException(compound.getOperator() + " 无法精确求值", compound.getPosition());
        };
    }

    private Rational power(Compound node, TypeEnvironment types) {
        Expression exponentNode = node.operand(1);
        if (!(exponentNode instanceof IntLiteral exponentLiteral) || exponentLiteral.getValue() < 0) {
            throw new UnsupportedConstructException("POW 的指数必须是非负整数字面量", exponentNode.getPosition());
        }
        long exponent = exponentLiteral.getValue();
        if (exponent > maxExponent) {
            throw new ExponentTooLargeException(exponent, maxExponent, exponentNode.getPosition());
        }
        return number(node.operand(0), types).pow((int) exponent);
    }

    /**
     * 除数为零时抛出编译错误；SMT-LIB 中除以零的值是未指定的，这里不给出任何值。
     */
    private Rational divisor(Expression node, TypeEnvironment types) {
        Rational divisor = number(node, types);
        if (divisor.isZero()) {
            throw new DivisionByZeroException(node.getPosition());
        }
        return divisor;
    }

    private boolean bool(Expression node, TypeEnvironment types) {
        return (Boolean) evaluate(node, types);
    }

    private Rational number(Expression node, TypeEnvironment types) {
        return (Rational) evaluate(node, types);
    }
}
