package org.qwed.validation;

import org.qwed.errors.SourcePosition;
import org.qwed.errors.ValidationException;
import org.qwed.errors.ValidationFailure;
import org.qwed.expressions.BoolLiteral;
import org.qwed.expressions.Compound;
import org.qwed.expressions.Expression;
import org.qwed.expressions.IntLiteral;
import org.qwed.expressions.RealLiteral;
import org.qwed.expressions.StringLiteral;
import org.qwed.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 基于并查集的类别推断。每个节点对应一个类别类，约束通过合并类传播；
 * "同名变量只有一个类别" 的不变式只在这里检查。
 * <p>
 * 整数字面量与 REAL 合并时拓宽为 REAL；MOD、LEN、数组下标和 SUM 要求的 INT 是精确的，
 * 不能拓宽。无法确定的数值类默认为 INT。
 * 每次推断使用一个新实例，非线程安全。
 */
final class SortInference {

    private static final Logger logger = LoggerFactory.getLogger(SortInference.class);

    private enum Category { UNKNOWN, BOOL, NUMERIC, STRING, ARRAY }

    private static final class SortClass {
        Category category = Category.UNKNOWN;
        boolean real;
        boolean exactInt;
        int element = -1;
    }

    /** 量词引入的绑定变量。enclosing 为外层同名绑定的类，没有时为 -1。 */
    private static final class Binder {
        final String name;
        final int sortClass;
        final int enclosing;
        final Compound quantifier;

        Binder(String name, int sortClass, int enclosing, Compound quantifier) {
            this.name = name;
            this.sortClass = sortClass;
            this.enclosing = enclosing;
            this.quantifier = quantifier;
        }
    }

    private final List<Integer> parent = new ArrayList<>();
    private final List<SortClass> classes = new ArrayList<>();
    private final Map<Integer, Integer> nodeClasses = new HashMap<>();
    private final Map<String, Integer> freeVariables = new HashMap<>();
    private final Deque<Map.Entry<String, Integer>> scope = new ArrayDeque<>();
    private final List<Binder> binders = new ArrayList<>();

    /**
     * @param root 已通过元数检查的语法树。
     * @param rootKind 对根节点的期望。
     * @return 每个节点和自由变量的类别。
     * @throws ValidationException TYPE_CONFLICT / BINDER_CONFLICT / INVALID_BINDER。
     */
    TypeEnvironment infer(Expression root, RootKind rootKind) {
        int rootClass = visit(root);
        if (rootKind == RootKind.FORMULA) {
            constrain(rootClass, Category.BOOL, root.getPosition());
        } else {
            constrain(rootClass, Category.NUMERIC, root.getPosition());
        }

        Map<Integer, ValueSort> binderSorts = new HashMap<>();
        for (Binder binder : binders) {
            ValueSort sort = resolve(binder.sortClass);
            if (!sort.isNumeric()) {
                throw fail(ValidationFailure.INVALID_BINDER, binder.quantifier.getPosition(),
                        "绑定变量 " + binder.name + " 的类别必须是 INT 或 REAL，实际为 " + sort);
            }
            Integer free = freeVariables.get(binder.name);
            if (free != null && resolve(free) != sort) {
                throw fail(ValidationFailure.BINDER_CONFLICT, binder.quantifier.getPosition(),
                        "绑定变量 " + binder.name + " 与同名自由变量类别不同: " + sort + " / " + resolve(free));
            }
            if (binder.enclosing >= 0 && resolve(binder.enclosing) != sort) {
                throw fail(ValidationFailure.BINDER_CONFLICT, binder.quantifier.getPosition(),
                        "绑定变量 " + binder.name + " 与外层同名绑定类别不同");
            }
            binderSorts.put(binder.quantifier.getNodeId(), sort);
        }

        Map<Integer, ValueSort> nodeSorts = new HashMap<>();
        nodeClasses.forEach((nodeId, sortClass) -> nodeSorts.put(nodeId, resolve(sortClass)));
        Map<String, ValueSort> freeSorts = new HashMap<>();
        freeVariables.forEach((name, sortClass) -> freeSorts.put(name, resolve(sortClass)));
        logger.debug("类别推断完成: {} 个类, 自由变量 {}", classes.size(), freeSorts);
        return new TypeEnvironment(nodeSorts, freeSorts, binderSorts);
    }

    private int visit(Expression node) {
        int sortClass;
        if (node instanceof Variable variable) {
            sortClass = variableClass(variable.getName());
        } else if (node instanceof IntLiteral) {
            sortClass = newClass();
            constrain(sortClass, Category.NUMERIC, node.getPosition());
        } else if (node instanceof RealLiteral) {
            sortClass = newClass();
            markReal(sortClass, node.getPosition());
        } else if (node instanceof BoolLiteral) {
            sortClass = newClass();
            constrain(sortClass, Category.BOOL, node.getPosition());
        } else if (node instanceof StringLiteral) {
            sortClass = newClass();
            constrain(sortClass, Category.STRING, node.getPosition());
        } else if (node instanceof Compound compound) {
            sortClass = visitCompound(compound);
        } else {
            throw new IllegalStateException("未知节点类型: " + node.getClass().getName());
        }
        nodeClasses.put(node.getNodeId(), sortClass);
        return sortClass;
    }

    private int visitCompound(Compound node) {
        SourcePosition pos = node.getPosition();
        if (node.getOperator().isQuantifier()) {
            return visitQuantifier(node);
        }
        int[] operands = new int[node.arity()];
        for (int i = 0; i < operands.length; i++) {
            operands[i] = visit(node.operand(i));
        }
        int result = newClass();
        switch (node.getOperator()) {
            case AND, OR, NOT, IMPLIES, IFF, XOR -> {
                for (int operand : operands) {
                    constrain(operand, Category.BOOL, pos);
                }
                constrain(result, Category.BOOL, pos);
            }
            case EQ, NE -> {
                union(operands[0], operands[1], pos);
                constrain(result, Category.BOOL, pos);
            }
            case GT, GE, LT, LE -> {
                constrain(operands[0], Category.NUMERIC, pos);
                union(operands[0], operands[1], pos);
                constrain(result, Category.BOOL, pos);
            }
            case PLUS, MINUS, MULT, DIV, ABS, NEG -> {
                constrain(result, Category.NUMERIC, pos);
                for (int operand : operands) {
                    union(result, operand, pos);
                }
            }
            case MOD -> {
                markExactInt(result, pos);
                union(result, operands[0], pos);
                union(result, operands[1], pos);
            }
            case POW -> {
                constrain(result, Category.NUMERIC, pos);
                union(result, operands[0], pos);
                // 指数独立成类，是否为字面量由编译器检查
                constrain(operands[1], Category.NUMERIC, pos);
            }
            case LEN -> {
                requireArray(operands[0], pos);
                markExactInt(result, pos);
            }
            case GET -> {
                int element = requireArray(operands[0], pos);
                markExactInt(operands[1], pos);
                union(result, element, pos);
            }
            case SET -> {
                int element = requireArray(operands[0], pos);
                markExactInt(operands[1], pos);
                union(element, operands[2], pos);
                union(result, operands[0], pos);
            }
            case SUM -> {
                int element = requireArray(operands[0], pos);
                markExactInt(operands[1], pos);
                union(result, element, pos);
            }
            case FORALL, EXISTS -> throw new IllegalStateException("量词应已单独处理");
        }
        return result;
    }

    private int visitQuantifier(Compound node) {
        Expression binderNode = node.operand(0);
        if (!(binderNode instanceof Variable variable)) {
            throw fail(ValidationFailure.INVALID_BINDER, binderNode.getPosition(),
                    node.getOperator() + " 的第一个操作数必须是变量");
        }
        String name = variable.getName();
        int enclosing = lookupScope(name);
        int binderClass = newClass();
        nodeClasses.put(binderNode.getNodeId(), binderClass);
        binders.add(new Binder(name, binderClass, enclosing, node));

        scope.push(Map.entry(name, binderClass));
        try {
            int body = visit(node.operand(1));
            constrain(body, Category.BOOL, node.operand(1).getPosition());
        } finally {
            scope.pop();
        }
        int result = newClass();
        constrain(result, Category.BOOL, node.getPosition());
        return result;
    }

    private int variableClass(String name) {
        int bound = lookupScope(name);
        if (bound >= 0) {
            return bound;
        }
        return freeVariables.computeIfAbsent(name, ignored -> newClass());
    }

    private int lookupScope(String name) {
        // ArrayDeque.push 放在队首，迭代从最内层开始
        Iterator<Map.Entry<String, Integer>> it = scope.iterator();
        while (it.hasNext()) {
            Map.Entry<String, Integer> entry = it.next();
            if (entry.getKey().equals(name)) {
                return entry.getValue();
            }
        }
        return -1;
    }

    // ========== 并查集 ==========

    private int newClass() {
        int id = classes.size();
        classes.add(new SortClass());
        parent.add(id);
        return id;
    }

    private int find(int sortClass) {
        int root = sortClass;
        while (parent.get(root) != root) {
            root = parent.get(root);
        }
        // 路径压缩
        while (parent.get(sortClass) != root) {
            int next = parent.get(sortClass);
            parent.set(sortClass, root);
            sortClass = next;
        }
        return root;
    }

    private void union(int a, int b, SourcePosition pos) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return;
        }
        SortClass infoA = classes.get(rootA);
        SortClass infoB = classes.get(rootB);
        Category merged = mergeCategory(infoA.category, infoB.category, pos);
        parent.set(rootB, rootA);
        infoA.category = merged;
        infoA.real |= infoB.real;
        infoA.exactInt |= infoB.exactInt;
        checkNumericFlags(infoA, pos);
        if (infoA.element < 0) {
            infoA.element = infoB.element;
        } else if (infoB.element >= 0) {
            union(infoA.element, infoB.element, pos);
        }
    }

    private void constrain(int sortClass, Category category, SourcePosition pos) {
        SortClass info = classes.get(find(sortClass));
        info.category = mergeCategory(info.category, category, pos);
    }

    private void markReal(int sortClass, SourcePosition pos) {
        constrain(sortClass, Category.NUMERIC, pos);
        SortClass info = classes.get(find(sortClass));
        info.real = true;
        checkNumericFlags(info, pos);
    }

    private void markExactInt(int sortClass, SourcePosition pos) {
        constrain(sortClass, Category.NUMERIC, pos);
        SortClass info = classes.get(find(sortClass));
        info.exactInt = true;
        checkNumericFlags(info, pos);
    }

    /**
     * @return 数组元素所在的类。
     */
    private int requireArray(int sortClass, SourcePosition pos) {
        constrain(sortClass, Category.ARRAY, pos);
        SortClass info = classes.get(find(sortClass));
        if (info.element < 0) {
            int element = newClass();
            constrain(element, Category.NUMERIC, pos);
            info.element = element;
        }
        return info.element;
    }

    private Category mergeCategory(Category left, Category right, SourcePosition pos) {
        if (left == Category.UNKNOWN) {
            return right;
        }
        if (right == Category.UNKNOWN || left == right) {
            return left;
        }
        throw fail(ValidationFailure.TYPE_CONFLICT, pos, "类型冲突: " + left + " 与 " + right);
    }

    private void checkNumericFlags(SortClass info, SourcePosition pos) {
        if (info.real && info.exactInt) {
            throw fail(ValidationFailure.TYPE_CONFLICT, pos, "类型冲突: 此处要求精确的 INT，但操作数是 REAL");
        }
    }

    private ValueSort resolve(int sortClass) {
        SortClass info = classes.get(find(sortClass));
        return switch (info.category) {
            case BOOL -> ValueSort.BOOL;
            case STRING -> ValueSort.STRING;
            case NUMERIC, UNKNOWN -> info.real ? ValueSort.REAL : ValueSort.INT;
            case ARRAY -> info.element >= 0 && resolve(info.element) == ValueSort.REAL
                    ? ValueSort.REAL_ARRAY : ValueSort.INT_ARRAY;
        };
    }

    private static ValidationException fail(ValidationFailure failure, SourcePosition pos, String message) {
        logger.warn("类别推断失败 [{}] @{}", failure, pos);
        return new ValidationException(failure, pos, message);
    }
}
