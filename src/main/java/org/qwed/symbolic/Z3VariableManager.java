package org.qwed.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.qwed.validation.ValueSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 负责管理变量名到 Z3 常量的映射。
 * 确保每个变量名在一个 Z3 Context 中有唯一的对应常量，且类别一致。
 * 数组变量额外带一个长度常量 len(name)，并断言其非负。
 * 一个实例只属于一个求解会话，不会有并发访问。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 按名字排序，保证声明顺序与插入顺序无关
    private final SortedMap<String, Expr> declarations;
    private final Map<String, ValueSort> sorts;
    private final Map<String, ArithExpr> arrayLengths;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.declarations = new TreeMap<>();
        this.sorts = new HashMap<>();
        this.arrayLengths = new HashMap<>();
    }

    /**
     * 获取指定名字与类别对应的 Z3 常量。
     * 如果常量尚未创建，则会创建并缓存。
     * @param name 变量名。
     * @param sort 推断得到的类别。
     * @return 对应的 Z3 常量。
     * @throws IllegalStateException 同名变量已以其他类别声明。
     */
    public Expr getZ3Var(String name, ValueSort sort) {
        ValueSort existing = sorts.get(name);
        if (existing != null) {
            if (existing != sort) {
                logger.error("变量 {} 已声明为 {}，不能再声明为 {}", name, existing, sort);
                throw new IllegalStateException("变量 " + name + " 的类别冲突: " + existing + " / " + sort);
            }
            return declarations.get(name);
        }
        Expr constant = mkConst(name, sort);
        sorts.put(name, sort);
        declarations.put(name, constant);
        if (sort.isArray()) {
            String lengthName = lengthName(name);
            ArithExpr length = ctx.mkIntConst(lengthName);
            arrayLengths.put(name, length);
            declarations.put(lengthName, length);
        }
        logger.debug("创建 Z3 变量: {} : {}", name, sort);
        return constant;
    }

    /**
     * 获取数组变量的长度常量。
     * @throws IllegalStateException 变量不是已声明的数组。
     */
    public ArithExpr getLength(String arrayName) {
        ArithExpr length = arrayLengths.get(arrayName);
        if (length == null) {
            logger.error("{} 不是已声明的数组变量", arrayName);
            throw new IllegalStateException(arrayName + " 不是已声明的数组变量");
        }
        return length;
    }

    /**
     * 为量词创建绑定常量。绑定常量不进入声明表。
     */
    public Expr mkBound(String name, ValueSort sort) {
        return mkConst(name, sort);
    }

    /**
     * 全局约束：所有数组长度非负。按名字排序输出。
     */
    public List<BoolExpr> globalConstraints() {
        List<String> names = new ArrayList<>(arrayLengths.keySet());
        Collections.sort(names);
        List<BoolExpr> constraints = new ArrayList<>(names.size());
        for (String name : names) {
            constraints.add(ctx.mkGe(arrayLengths.get(name), ctx.mkInt(0)));
        }
        return constraints;
    }

    public Sort toZ3Sort(ValueSort sort) {
        return switch (sort) {
            case BOOL -> ctx.getBoolSort();
            case INT -> ctx.getIntSort();
            case REAL -> ctx.getRealSort();
            case STRING -> ctx.getStringSort();
            case INT_ARRAY -> ctx.mkArraySort(ctx.getIntSort(), ctx.getIntSort());
            case REAL_ARRAY -> ctx.mkArraySort(ctx.getIntSort(), ctx.getRealSort());
        };
    }

    private Expr mkConst(String name, ValueSort sort) {
        return switch (sort) {
            case BOOL -> ctx.mkBoolConst(name);
            case INT -> ctx.mkIntConst(name);
            case REAL -> ctx.mkRealConst(name);
            case STRING -> ctx.mkConst(name, ctx.getStringSort());
            case INT_ARRAY -> ctx.mkArrayConst(name, ctx.getIntSort(), ctx.getIntSort());
            case REAL_ARRAY -> ctx.mkArrayConst(name, ctx.getIntSort(), ctx.getRealSort());
        };
    }

    static String lengthName(String arrayName) {
        return "len(" + arrayName + ")";
    }
}
