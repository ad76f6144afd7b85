package org.qwed.consensus;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.qwed.core.VerificationMode;
import org.qwed.engine.EngineResult;
import org.qwed.engine.EngineStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次请求的最终判定。不可变，按值比较：同一产物在相同时钟和熔断状态下重跑得到相等的判定。
 */
@Getter
@EqualsAndHashCode
public final class ConsensusVerdict {

    private final VerificationMode mode;
    private final EngineStatus finalStatus;
    private final double aggregateConfidence;
    private final Agreement agreement;
    /** 按引擎 id 排序。 */
    private final List<EngineResult> perEngineResults;
    private final List<OrchestratorIssue> issues;

    ConsensusVerdict(VerificationMode mode, EngineStatus finalStatus, double aggregateConfidence,
                     Agreement agreement, Collection<EngineResult> perEngineResults,
                     Collection<OrchestratorIssue> issues) {
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
        this.finalStatus = Objects.requireNonNull(finalStatus, "finalStatus cannot be null");
        this.aggregateConfidence = aggregateConfidence;
        this.agreement = Objects.requireNonNull(agreement, "agreement cannot be null");
        List<EngineResult> sorted = new ArrayList<>(perEngineResults);
        sorted.sort(Comparator.comparing(EngineResult::getEngineId));
        this.perEngineResults = Collections.unmodifiableList(sorted);
        EnumSet<OrchestratorIssue> issueSet = EnumSet.noneOf(OrchestratorIssue.class);
        issueSet.addAll(issues);
        this.issues = List.copyOf(issueSet);
    }

    public boolean isVerified() {
        return finalStatus == EngineStatus.VERIFIED;
    }

    public boolean isDegraded() {
        return !issues.isEmpty();
    }

    public Optional<EngineResult> resultOf(String engineId) {
        return perEngineResults.stream().filter(r -> r.getEngineId().equals(engineId)).findFirst();
    }

    @Override
    public String toString() {
        return "ConsensusVerdict(" + finalStatus + ", " + agreement + ", confidence=" + aggregateConfidence
                + ", " + perEngineResults + (issues.isEmpty() ? "" : ", issues=" + issues) + ")";
    }
}
