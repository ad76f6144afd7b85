package org.qwed.compiler;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 编译产物：一个主断言，加上变量声明和定义域约束（数组长度非负）。
 * 只在求解会话内部使用，生命周期不超过创建它的 Z3 Context。
 */
@Getter
public final class CompiledConstraint {

    private final BoolExpr assertion;
    private final List<BoolExpr> sideConditions;
    private final SortedMap<String, Expr> declarations;
    /** 需要在模型中额外求值的项，例如算术声称中的表达式本身。 */
    private final Map<String, Expr> observed;
    private final String smtLib;

    CompiledConstraint(BoolExpr assertion, List<BoolExpr> sideConditions,
                       SortedMap<String, Expr> declarations, Map<String, Expr> observed) {
        this.assertion = assertion;
        this.sideConditions = List.copyOf(sideConditions);
        this.declarations = Collections.unmodifiableSortedMap(new TreeMap<>(declarations));
        this.observed = Collections.unmodifiableMap(new LinkedHashMap<>(observed));
        this.smtLib = render();
    }

    /**
     * 主断言取反，声明和定义域约束保持不变。用于有效性检查：否定不可满足即原命题恒真。
     */
    public CompiledConstraint negate(Context ctx) {
        return new CompiledConstraint(ctx.mkNot(assertion), sideConditions, declarations, observed);
    }

    /**
     * 渲染为 SMT-LIB 2 文本。相同的语法树总是得到逐字节相同的文本。
     */
    private String render() {
        StringBuilder sb = new StringBuilder();
        for (Expr constant : declarations.values()) {
            sb.append("(declare-const ").append(constant).append(' ').append(constant.getSort()).append(")\n");
        }
        for (BoolExpr side : sideConditions) {
            sb.append("(assert ").append(side).append(")\n");
        }
        sb.append("(assert ").append(assertion).append(")\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return smtLib;
    }
}
