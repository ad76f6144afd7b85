package org.qwed.engine.logic;

import org.qwed.core.LogicGoal;
import org.qwed.engine.EngineResult;
import org.qwed.engine.SolverDetail;
import org.qwed.symbolic.SolverOutcome;

/**
 * 把求解器的三路结果渲染为引擎结果。
 * <ul>
 *     <li>SATISFIABLE：SAT 为 VERIFIED（附模型），UNSAT 为 FAILED。</li>
 *     <li>VALID：检查的是否定式，UNSAT 为 VERIFIED，SAT 为 FAILED（模型即反例）。</li>
 *     <li>UNKNOWN 一律为置信度 0 的 FAILED，不会被当作通过。</li>
 * </ul>
 */
final class ResultFormatter {

    private final String engineId;

    ResultFormatter(String engineId) {
        this.engineId = engineId;
    }

    EngineResult format(LogicGoal goal, SolverOutcome outcome, String smtLib) {
        SolverDetail detail = new SolverDetail(goal, outcome, smtLib);
        return switch (outcome.getSatisfiability()) {
            case SAT -> goal == LogicGoal.SATISFIABLE
                    ? EngineResult.verified(engineId, 1.0, detail)
                    : EngineResult.failed(engineId, 1.0, detail);
            case UNSAT -> goal == LogicGoal.VALID
                    ? EngineResult.verified(engineId, 1.0, detail)
                    : EngineResult.failed(engineId, 1.0, detail);
            case UNKNOWN -> EngineResult.failed(engineId, 0.0, detail);
        };
    }
}
