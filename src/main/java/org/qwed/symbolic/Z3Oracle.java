package org.qwed.symbolic;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.qwed.compiler.CompiledConstraint;
import org.qwed.errors.SolverInternalException;
import org.qwed.errors.SolverTimeoutException;
import org.qwed.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Z3 求解会话。持有一个 Z3 Context 和对应的变量管理器，关闭时释放 Context。
 * @author Ayalyt
 */
public class Z3Oracle implements SolverSession {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private static final int ALGEBRAIC_PRECISION = 10;

    @Getter
    private final Context context;
    private final Z3VariableManager variableManager;
    private final long timeoutMillis;
    private boolean closed = false;

    Z3Oracle(Context context, long timeoutMillis) {
        this.context = Objects.requireNonNull(context, "Z3 Context cannot be null.");
        this.variableManager = new Z3VariableManager(context);
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public Z3VariableManager variables() {
        return variableManager;
    }

    @Override
    public SolverOutcome check(CompiledConstraint constraint) {
        if (closed) {
            throw new IllegalStateException("Z3 会话已关闭");
        }
        try {
            Solver solver = context.mkSolver();
            Params params = context.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeoutMillis));
            solver.setParameters(params);
            for (BoolExpr side : constraint.getSideConditions()) {
                solver.add(side);
            }
            solver.add(constraint.getAssertion());

            Status status = solver.check();
            logger.debug("Z3 求解结果: {}", status);
            return switch (status) {
                case SATISFIABLE -> sat(solver.getModel(), constraint);
                case UNSATISFIABLE -> SolverOutcome.unsat();
                case UNKNOWN -> unknown(solver.getReasonUnknown());
            };
        } catch (Z3Exception e) {
            logger.error("Z3 内部错误: {}", e.getMessage());
            throw new SolverInternalException("Z3 内部错误: " + e.getMessage(), e);
        }
    }

    private SolverOutcome unknown(String reason) {
        String normalized = reason == null ? "" : reason.toLowerCase(Locale.ROOT);
        if (normalized.contains("timeout") || normalized.contains("canceled") || normalized.contains("cancelled")) {
            logger.warn("Z3 求解超时 ({}ms)", timeoutMillis);
            throw new SolverTimeoutException(timeoutMillis);
        }
        logger.warn("Z3 无法判定: {}", reason);
        return SolverOutcome.unknown(reason);
    }

    private SolverOutcome sat(Model model, CompiledConstraint constraint) {
        Map<String, String> bindings = new LinkedHashMap<>();
        for (Map.Entry<String, Expr> entry : constraint.getDeclarations().entrySet()) {
            bindings.put(entry.getKey(), render(model.eval(entry.getValue(), true)));
        }
        Map<String, String> observed = new LinkedHashMap<>();
        for (Map.Entry<String, Expr> entry : constraint.getObserved().entrySet()) {
            observed.put(entry.getKey(), render(model.eval(entry.getValue(), true)));
        }
        return SolverOutcome.sat(bindings, observed);
    }

    /**
     * 把模型中的值渲染为文本：整数与有理数精确输出，代数数保留若干位小数。
     */
    static String render(Expr value) {
        if (value instanceof IntNum intNum) {
            return Rational.fromZ3(intNum).toString();
        }
        if (value instanceof RatNum ratNum) {
            return Rational.fromZ3(ratNum).toString();
        }
        if (value.isAlgebraicNumber()) {
            return ((AlgebraicNum) value).toDecimal(ALGEBRAIC_PRECISION);
        }
        if (value.isTrue()) {
            return "true";
        }
        if (value.isFalse()) {
            return "false";
        }
        if (value.isString()) {
            return value.getString();
        }
        return value.toString();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            context.close();
            logger.debug("Z3 会话已关闭");
        }
    }
}
