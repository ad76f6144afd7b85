package org.qwed.validation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.qwed.expressions.Expression;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 类型推断的结果：每个节点的类别，以及每个自由变量的类别（按名字排序）。
 * 绑定变量的类别记录在量词节点编号下。此类是不可变的。
 */
@Getter
@EqualsAndHashCode
public final class TypeEnvironment {

    private final Map<Integer, ValueSort> nodeSorts;
    private final SortedMap<String, ValueSort> freeVariables;
    private final Map<Integer, ValueSort> binderSorts;

    TypeEnvironment(Map<Integer, ValueSort> nodeSorts,
                    Map<String, ValueSort> freeVariables,
                    Map<Integer, ValueSort> binderSorts) {
        this.nodeSorts = Collections.unmodifiableMap(nodeSorts);
        this.freeVariables = Collections.unmodifiableSortedMap(new TreeMap<>(freeVariables));
        this.binderSorts = Collections.unmodifiableMap(binderSorts);
    }

    /**
     * @throws IllegalStateException 节点不属于推断过的树时抛出。
     */
    public ValueSort sortOf(Expression node) {
        ValueSort sort = nodeSorts.get(node.getNodeId());
        if (sort == null) {
            throw new IllegalStateException("节点 #" + node.getNodeId() + " 没有推断类别");
        }
        return sort;
    }

    /**
     * @param quantifier FORALL/EXISTS 节点。
     */
    public ValueSort binderSortOf(Expression quantifier) {
        ValueSort sort = binderSorts.get(quantifier.getNodeId());
        if (sort == null) {
            throw new IllegalStateException("节点 #" + quantifier.getNodeId() + " 不是量词");
        }
        return sort;
    }
}
