package com.infra.whatif.service;

import com.infra.whatif.engine.BucketEvaluation;
import com.infra.whatif.model.OracleVerdict;
import com.infra.whatif.model.RiskAssessment;
import com.infra.whatif.model.RiskBucket;
import com.infra.whatif.model.RiskBucketAssessment;
import com.infra.whatif.model.RiskLevel;
import com.infra.whatif.model.Verdict;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the final verdict from the bucket evaluation. Safety and failed buckets come
 * only from the threshold comparison; the classifier's own verdict contributes its
 * reasoning text and nothing else.
 */
@Service
public class VerdictService {

    static final String ALL_PASSED = "All risk buckets are below their thresholds.";

    public Verdict assemble(BucketEvaluation evaluation, OracleVerdict oracleVerdict) {
        Map<RiskBucket, RiskLevel> levels = levelsByBucket(evaluation.normalizedAssessment());

        RiskLevel overall = RiskLevel.LOW;
        for (RiskLevel level : levels.values()) {
            overall = RiskLevel.max(overall, level);
        }

        // Highest failed bucket; ties go to the earlier bucket in drift/intent/operations order.
        String highestBucket = RiskBucket.NONE;
        RiskLevel highestLevel = null;
        for (RiskBucket bucket : evaluation.failedBuckets()) {
            RiskLevel level = levels.getOrDefault(bucket, RiskLevel.LOW);
            if (highestLevel == null || level.index() > highestLevel.index()) {
                highestLevel = level;
                highestBucket = bucket.getId();
            }
        }

        return Verdict.builder()
                .safe(evaluation.safe())
                .highestRiskBucket(highestBucket)
                .overallRiskLevel(overall)
                .reasoning(reasoning(evaluation, oracleVerdict))
                .failedBuckets(evaluation.failedBuckets())
                .build();
    }

    private String reasoning(BucketEvaluation evaluation, OracleVerdict oracleVerdict) {
        String oracleReasoning = oracleVerdict != null && oracleVerdict.getReasoning() != null
                && !oracleVerdict.getReasoning().isBlank()
                ? oracleVerdict.getReasoning().strip()
                : null;

        if (evaluation.safe()) {
            return oracleReasoning != null ? oracleReasoning : ALL_PASSED;
        }

        String failed = evaluation.failedBuckets().stream()
                .map(RiskBucket::getId)
                .collect(Collectors.joining(", "));
        String blocked = "Deployment blocked: failed risk buckets: " + failed + ".";
        return oracleReasoning != null ? blocked + " " + oracleReasoning : blocked;
    }

    private Map<RiskBucket, RiskLevel> levelsByBucket(RiskAssessment assessment) {
        Map<RiskBucket, RiskLevel> levels = new EnumMap<>(RiskBucket.class);
        put(levels, RiskBucket.DRIFT, assessment.getDrift());
        put(levels, RiskBucket.INTENT, assessment.getIntent());
        put(levels, RiskBucket.OPERATIONS, assessment.getOperations());
        return levels;
    }

    private void put(Map<RiskBucket, RiskLevel> levels, RiskBucket bucket, RiskBucketAssessment assessment) {
        if (assessment == null) return;
        RiskLevel level = RiskLevel.parse(assessment.getRiskLevel());
        levels.put(bucket, level != null ? level : RiskLevel.LOW);
    }
}
