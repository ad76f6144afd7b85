package org.qwed.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.qwed.core.LogicGoal;
import org.qwed.symbolic.Satisfiability;
import org.qwed.symbolic.SolverOutcome;

import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * 逻辑引擎的结果：求解器判定、模型（SAT 时）以及送入求解器的 SMT-LIB 文本。
 * VALID 目标检查的是否定式，此时模型即反例。
 */
@Getter
@EqualsAndHashCode
public final class SolverDetail implements EngineDetail {

    private final LogicGoal goal;
    private final Satisfiability satisfiability;
    private final SortedMap<String, String> model;
    private final SortedMap<String, String> observed;
    private final String smtLib;
    private final String reasonUnknown;

    public SolverDetail(LogicGoal goal, SolverOutcome outcome, String smtLib) {
        this.goal = Objects.requireNonNull(goal, "goal cannot be null");
        this.satisfiability = outcome.getSatisfiability();
        this.model = outcome.getModel();
        this.observed = outcome.getObserved();
        this.smtLib = Objects.requireNonNull(smtLib, "smtLib cannot be null");
        this.reasonUnknown = outcome.getReasonUnknown().orElse(null);
    }

    public Optional<String> getReasonUnknown() {
        return Optional.ofNullable(reasonUnknown);
    }

    @Override
    public String summary() {
        return goal + " " + satisfiability + (model.isEmpty() ? "" : " " + model);
    }

    @Override
    public String toString() {
        return summary();
    }
}
