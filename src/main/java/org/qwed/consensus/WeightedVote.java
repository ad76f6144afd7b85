package org.qwed.consensus;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.qwed.engine.EngineResult;
import org.qwed.engine.EngineStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 加权投票。输入是 (结果, 权重) 对，计算与完成顺序无关。
 * <p>
 * 分母只含有响应的引擎（超时不计入分子和分母）；某状态的份额 = Σ 权重 × 置信度 / 分母。
 * VERIFIED 需要份额达到阈值且严格过半，平局从不通过；任何 BLOCKED 一票否决。
 * 最终置信度 = 最终状态的份额 × 覆盖率，覆盖率 = 有响应的权重 / 选中的权重。
 */
@Getter
public final class WeightedVote {

    private final EngineStatus finalStatus;
    private final Agreement agreement;
    private final double confidence;
    private final Map<EngineStatus, Double> shares;

    private WeightedVote(EngineStatus finalStatus, Agreement agreement, double confidence,
                         Map<EngineStatus, Double> shares) {
        this.finalStatus = finalStatus;
        this.agreement = agreement;
        this.confidence = confidence;
        this.shares = Collections.unmodifiableMap(shares);
    }

    /**
     * @param votes 每个选中引擎的结果及其权重，调用方保证按引擎 id 排序。
     * @param threshold 多数阈值，(0, 1]。
     */
    public static WeightedVote tally(List<Pair<EngineResult, Double>> votes, double threshold) {
        double selectedWeight = 0.0;
        double respondingWeight = 0.0;
        Map<EngineStatus, Double> weighted = new EnumMap<>(EngineStatus.class);
        EnumMap<EngineStatus, Integer> counts = new EnumMap<>(EngineStatus.class);
        for (Pair<EngineResult, Double> vote : votes) {
            EngineResult result = vote.getLeft();
            double weight = vote.getRight();
            selectedWeight += weight;
            if (result.getStatus() == EngineStatus.TIMEOUT) {
                continue;
            }
            respondingWeight += weight;
            weighted.merge(result.getStatus(), weight * result.getConfidence(), Double::sum);
            counts.merge(result.getStatus(), 1, Integer::sum);
        }
        if (respondingWeight == 0.0) {
            return new WeightedVote(EngineStatus.FAILED, Agreement.SPLIT, 0.0, new EnumMap<>(EngineStatus.class));
        }

        Map<EngineStatus, Double> shares = new EnumMap<>(EngineStatus.class);
        EngineStatus leading = null;
        for (Map.Entry<EngineStatus, Double> entry : weighted.entrySet()) {
            double share = entry.getValue() / respondingWeight;
            shares.put(entry.getKey(), share);
            if (leading == null || share > shares.get(leading)) {
                leading = entry.getKey();
            }
        }
        double coverage = respondingWeight / selectedWeight;

        Agreement agreement;
        if (counts.size() == 1) {
            agreement = Agreement.UNANIMOUS;
        } else if (shares.get(leading) >= threshold && shares.get(leading) > 0.5) {
            agreement = Agreement.MAJORITY;
        } else {
            agreement = Agreement.SPLIT;
        }

        EngineStatus finalStatus;
        if (counts.containsKey(EngineStatus.BLOCKED)) {
            finalStatus = EngineStatus.BLOCKED;
        } else {
            double verifiedShare = shares.getOrDefault(EngineStatus.VERIFIED, 0.0);
            if (verifiedShare >= threshold && verifiedShare > 0.5) {
                finalStatus = EngineStatus.VERIFIED;
            } else {
                finalStatus = EngineStatus.FAILED;
                if (leading == EngineStatus.VERIFIED) {
                    // 通过票领先但未达到阈值，不能提升为通过
                    agreement = Agreement.SPLIT;
                }
            }
        }
        double confidence = shares.getOrDefault(finalStatus, 0.0) * coverage;
        return new WeightedVote(finalStatus, agreement, confidence, shares);
    }
}
