package org.qwed.symbolic;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 求解器的三路结果：Sat(model) / Unsat / Unknown。
 * 模型以 变量名 → 值的文本 的形式给出，按名字排序；不暴露任何 Z3 对象。
 */
@Getter
@EqualsAndHashCode
public final class SolverOutcome {

    private static final SolverOutcome UNSAT = new SolverOutcome(Satisfiability.UNSAT, Map.of(), Map.of(), null);

    private final Satisfiability satisfiability;
    private final SortedMap<String, String> model;
    private final SortedMap<String, String> observed;
    private final String reasonUnknown;

    private SolverOutcome(Satisfiability satisfiability, Map<String, String> model,
                          Map<String, String> observed, String reasonUnknown) {
        this.satisfiability = Objects.requireNonNull(satisfiability, "satisfiability cannot be null");
        this.model = Collections.unmodifiableSortedMap(new TreeMap<>(model));
        this.observed = Collections.unmodifiableSortedMap(new TreeMap<>(observed));
        this.reasonUnknown = reasonUnknown;
    }

    public static SolverOutcome sat(Map<String, String> model, Map<String, String> observed) {
        return new SolverOutcome(Satisfiability.SAT, model, observed, null);
    }

    public static SolverOutcome unsat() {
        return UNSAT;
    }

    public static SolverOutcome unknown(String reason) {
        return new SolverOutcome(Satisfiability.UNKNOWN, Map.of(), Map.of(), reason == null ? "unknown" : reason);
    }

    public boolean isSat() {
        return satisfiability == Satisfiability.SAT;
    }

    public boolean isUnsat() {
        return satisfiability == Satisfiability.UNSAT;
    }

    public Optional<String> getReasonUnknown() {
        return Optional.ofNullable(reasonUnknown);
    }

    @Override
    public String toString() {
        return switch (satisfiability) {
            case SAT -> "Sat" + model;
            case UNSAT -> "Unsat";
            case UNKNOWN -> "Unknown(" + reasonUnknown + ")";
        };
    }
}
