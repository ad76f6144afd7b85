package org.qwed.compiler;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import org.qwed.core.VerificationConfig;
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
import org.qwed.expressions.Variable;
import org.qwed.symbolic.Z3VariableManager;
import org.qwed.utils.Rational;
import org.qwed.validation.RootKind;
import org.qwed.validation.TypeEnvironment;
import org.qwed.validation.ValidatedExpression;
import org.qwed.validation.ValueSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把已校验的语法树按结构递归编译为 Z3 项，每个运算符恰好对应一个分支。
 * 编译是纯函数：相同的语法树在新的会话中总是得到相同的 SMT-LIB 文本。
 * 编译器本身无状态，可以在线程间共享；每次调用的状态都在 {@link Scope} 中。
 */
public class ConstraintCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintCompiler.class);

    public static final String OBSERVED_VALUE = "value";

    private final int maxExponent;
    private final int maxSumUnroll;

    public ConstraintCompiler(int maxExponent, int maxSumUnroll) {
        if (maxExponent < 0 || maxSumUnroll < 0) {
            throw new IllegalArgumentException("maxExponent 与 maxSumUnroll 不能为负数");
        }
        this.maxExponent = maxExponent;
        this.maxSumUnroll = maxSumUnroll;
    }

    public static ConstraintCompiler fromConfig(VerificationConfig config) {
        return new ConstraintCompiler(config.getMaxExponent(), config.getMaxSumUnroll());
    }

    /**
     * 编译布尔约束。
     * @param expression 根为布尔类别的已校验表达式。
     * @param variables 当前会话的变量管理器。
     * @return 可交给求解器的约束。
     * @throws org.qwed.errors.CompileException 除零、不支持的构造或指数过大。
     */
    public CompiledConstraint compile(ValidatedExpression expression, Z3VariableManager variables) {
        if (expression.getRootKind() != RootKind.FORMULA) {
            throw new IllegalArgumentException("compile 只接受布尔约束，实际为 " + expression.rootSort());
        }
        Scope scope = new Scope(variables, expression.getTypes());
        BoolExpr assertion = (BoolExpr) scope.compile(expression.getRoot());
        CompiledConstraint compiled = new CompiledConstraint(assertion, variables.globalConstraints(),
                variables.getDeclarations(), Map.of());
        logger.debug("约束编译完成: {} 个声明", compiled.getDeclarations().size());
        return compiled;
    }

    /**
     * 编译算术声称：表达式的值等于 claim。
     * 表达式为 INT 且声称值是整数时精确比较；否则在实数上比较，允许 tolerance 的误差。
     * 表达式本身作为观察项 {@link #OBSERVED_VALUE} 保留，便于从模型中读出计算值。
     */
    public CompiledConstraint compileClaim(ValidatedExpression term, Rational claim, Rational tolerance,
                                           Z3VariableManager variables) {
        if (term.getRootKind() != RootKind.TERM) {
            throw new IllegalArgumentException("compileClaim 只接受数值表达式");
        }
        Context ctx = variables.getCtx();
        Scope scope = new Scope(variables, term.getTypes());
        ArithExpr value = (ArithExpr) scope.compile(term.getRoot());
        boolean integral = term.rootSort() == ValueSort.INT;

        BoolExpr assertion;
        if (integral && claim.isInteger()) {
            assertion = ctx.mkEq(value, claim.toZ3Int(ctx));
        } else {
            ArithExpr real = integral ? ctx.mkInt2Real((IntExpr) value) : value;
            ArithExpr diff = ctx.mkSub(real, claim.toZ3Real(ctx));
            assertion = ctx.mkLe(abs(ctx, diff, ctx.mkReal(0)), tolerance.toZ3Real(ctx));
        }
        Map<String, Expr> observed = new LinkedHashMap<>();
        observed.put(OBSERVED_VALUE, value);
        return new CompiledConstraint(assertion, variables.globalConstraints(), variables.getDeclarations(), observed);
    }

    private static ArithExpr abs(Context ctx, ArithExpr x, ArithExpr zero) {
        return (ArithExpr) ctx.mkITE(ctx.mkGe(x, zero), x, ctx.mkUnaryMinus(x));
    }

    /**
     * 单次编译的状态：绑定变量作用域。
     */
    private final class Scope {
        private final Z3VariableManager variables;
        private final TypeEnvironment types;
        private final Context ctx;
        private final Deque<Map.Entry<String, Expr>> bound = new ArrayDeque<>();

        Scope(Z3VariableManager variables, TypeEnvironment types) {
            this.variables = variables;
            this.types = types;
            this.ctx = variables.getCtx();
        }

        Expr compile(Expression node) {
            ValueSort sort = types.sortOf(node);
            if (node instanceof Variable variable) {
                return variable(variable.getName(), sort);
            }
            if (node instanceof IntLiteral literal) {
                return sort == ValueSort.REAL ? literal.toRational().toZ3Real(ctx) : ctx.mkInt(literal.getValue());
            }
            if (node instanceof RealLiteral literal) {
                return literal.toRational().toZ3Real(ctx);
            }
            if (node instanceof BoolLiteral literal) {
                return ctx.mkBool(literal.isValue());
            }
            if (node instanceof StringLiteral literal) {
                return ctx.mkString(literal.getValue());
            }
            return compound((Compound) node, sort);
        }

        private Expr variable(String name, ValueSort sort) {
            Iterator<Map.Entry<String, Expr>> it = bound.iterator();
            while (it.hasNext()) {
                Map.Entry<String, Expr> entry = it.next();
                if (entry.getKey().equals(name)) {
                    return entry.getValue();
                }
            }
            return variables.getZ3Var(name, sort);
        }

        private Expr compound(Compound node, ValueSort sort) {
            List<Expression> operands = node.getOperands();
            return switch (node.getOperator()) {
                case AND -> ctx.mkAnd(bools(operands));
                case OR -> ctx.mkOr(bools(operands));
                case NOT -> ctx.mkNot(bool(node.operand(0)));
                case IMPLIES -> ctx.mkImplies(bool(node.operand(0)), bool(node.operand(1)));
                case IFF -> ctx.mkIff(bool(node.operand(0)), bool(node.operand(1)));
                case XOR -> ctx.mkXor(bool(node.operand(0)), bool(node.operand(1)));
                case EQ, NE, GT, GE, LT, LE -> RelationType.of(node.getOperator())
                        .toZ3BoolExpr(ctx, compile(node.operand(0)), compile(node.operand(1)));
                case PLUS -> ctx.mkAdd(ariths(operands));
                case MINUS -> operands.size() == 1
                        ? ctx.mkUnaryMinus(arith(node.operand(0)))
                        : ctx.mkSub(ariths(operands));
                case MULT -> ctx.mkMul(ariths(operands));
                case DIV -> {
                    rejectZeroDivisor(node);
                    yield ctx.mkDiv(arith(node.operand(0)), arith(node.operand(1)));
                }
                case MOD -> {
                    rejectZeroDivisor(node);
                    yield ctx.mkMod((IntExpr) arith(node.operand(0)), (IntExpr) arith(node.operand(1)));
                }
                case POW -> power(node, sort);
                case ABS -> abs(ctx, arith(node.operand(0)), zero(sort));
                case NEG -> ctx.mkUnaryMinus(arith(node.operand(0)));
                case FORALL, EXISTS -> quantifier(node);
                case LEN -> variables.getLength(arrayBase(node.operand(0)));
                case GET -> ctx.mkSelect((ArrayExpr) compile(node.operand(0)), compile(node.operand(1)));
                case SET -> ctx.mkStore((ArrayExpr) compile(node.operand(0)),
                        compile(node.operand(1)), compile(node.operand(2)));
                case SUM -> sum(node, sort);
            };
        }

        private Expr power(Compound node, ValueSort sort) {
            Expression exponentNode = node.operand(1);
            if (!(exponentNode instanceof IntLiteral exponentLiteral)) {
                throw new UnsupportedConstructException("POW 的指数必须是整数字面量", exponentNode.getPosition());
            }
            long exponent = exponentLiteral.getValue();
            if (exponent < 0) {
                throw new UnsupportedConstructException("POW 不支持负指数 " + exponent, exponentNode.getPosition());
            }
            if (exponent > maxExponent) {
                logger.warn("拒绝过大的指数 {} (上限 {}) @{}", exponent, maxExponent, exponentNode.getPosition());
                throw new ExponentTooLargeException(exponent, maxExponent, exponentNode.getPosition());
            }
            if (exponent == 0) {
                return one(sort);
            }
            ArithExpr base = arith(node.operand(0));
            ArithExpr[] factors = new ArithExpr[(int) exponent];
            for (int i = 0; i < factors.length; i++) {
                factors[i] = base;
            }
            return factors.length == 1 ? base : ctx.mkMul(factors);
        }

        private Expr quantifier(Compound node) {
            String name = ((Variable) node.operand(0)).getName();
            Expr binder = variables.mkBound(name, types.binderSortOf(node));
            bound.push(Map.entry(name, binder));
            BoolExpr body;
            try {
                body = bool(node.operand(1));
            } finally {
                bound.pop();
            }
            Expr[] boundConstants = {binder};
            return switch (node.getOperator()) {
                case FORALL -> ctx.mkForall(boundConstants, body, 1, null, null, null, null);
                case EXISTS -> ctx.mkExists(boundConstants, body, 1, null, null, null, null);
                default -> throw new IllegalStateException("不是量词: " + node.getOperator());
            };
        }

        private Expr sum(Compound node, ValueSort sort) {
            Expression countNode = node.operand(1);
            if (!(countNode instanceof IntLiteral countLiteral)) {
                throw new UnsupportedConstructException("SUM 的元素个数必须是整数字面量", countNode.getPosition());
            }
            long count = countLiteral.getValue();
            if (count < 0 || count > maxSumUnroll) {
                throw new UnsupportedConstructException(
                        "SUM 的元素个数必须在 [0, " + maxSumUnroll + "] 内，实际为 " + count, countNode.getPosition());
            }
            if (count == 0) {
                return zero(sort);
            }
            ArrayExpr array = (ArrayExpr) compile(node.operand(0));
            ArithExpr[] elements = new ArithExpr[(int) count];
            for (int i = 0; i < elements.length; i++) {
                elements[i] = (ArithExpr) ctx.mkSelect(array, ctx.mkInt(i));
            }
            return elements.length == 1 ? elements[0] : ctx.mkAdd(elements);
        }

        /**
         * LEN 作用于 SET 时取其底层数组的长度。
         */
        private String arrayBase(Expression node) {
            Expression current = node;
            while (current instanceof Compound compound) {
                current = compound.operand(0);
            }
            if (!(current instanceof Variable variable)) {
                throw new UnsupportedConstructException("LEN 只能作用于数组变量", node.getPosition());
            }
            // 先确保数组已声明
            variables.getZ3Var(variable.getName(), types.sortOf(current));
            return variable.getName();
        }

        private void rejectZeroDivisor(Compound node) {
            Expression divisor = node.operand(1);
            boolean zero = (divisor instanceof IntLiteral i && i.getValue() == 0)
                    || (divisor instanceof RealLiteral r && r.getValue().signum() == 0);
            if (zero) {
                logger.warn("{} 的除数为字面量零 @{}", node.getOperator(), divisor.getPosition());
                throw new DivisionByZeroException(divisor.getPosition());
            }
        }

        private ArithExpr zero(ValueSort sort) {
            return sort == ValueSort.REAL ? ctx.mkReal(0) : ctx.mkInt(0);
        }

        private ArithExpr one(ValueSort sort) {
            return sort == ValueSort.REAL ? ctx.mkReal(1) : ctx.mkInt(1);
        }

        private BoolExpr bool(Expression node) {
            return (BoolExpr) compile(node);
        }

        private ArithExpr arith(Expression node) {
            return (ArithExpr) compile(node);
        }

        private BoolExpr[] bools(List<Expression> nodes) {
            BoolExpr[] result = new BoolExpr[nodes.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = bool(nodes.get(i));
            }
            return result;
        }

        private ArithExpr[] ariths(List<Expression> nodes) {
            ArithExpr[] result = new ArithExpr[nodes.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = arith(nodes.get(i));
            }
            return result;
        }
    }
}
