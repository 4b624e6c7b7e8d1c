package com.infra.whatif.engine;

import com.infra.whatif.model.BucketThresholds;
import com.infra.whatif.model.RiskAssessment;
import com.infra.whatif.model.RiskBucket;
import com.infra.whatif.model.RiskBucketAssessment;
import com.infra.whatif.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Gates a deployment on three independent risk buckets.
 *
 * A bucket fails when its risk level meets or exceeds the bucket's threshold
 * ({@code index(risk) >= index(threshold)}). Drift and operations are always evaluated;
 * intent only when the classifier produced it. Unknown levels are treated as low.
 */
@Component
public class RiskBucketEvaluator {

    static final String NO_ASSESSMENT_REASONING = "No risk assessment provided";

    public BucketEvaluation evaluate(RiskAssessment assessment, BucketThresholds thresholds,
                                     EvaluationDiagnostics diagnostics) {
        if (assessment == null || assessment.isEmpty()) {
            diagnostics.warn("No risk assessment supplied; treating deployment as safe with low-risk placeholders");
            RiskAssessment placeholder = RiskAssessment.builder()
                    .drift(RiskBucketAssessment.placeholder(RiskBucket.DRIFT, NO_ASSESSMENT_REASONING))
                    .operations(RiskBucketAssessment.placeholder(RiskBucket.OPERATIONS, NO_ASSESSMENT_REASONING))
                    .build();
            return new BucketEvaluation(true, List.of(), placeholder);
        }

        RiskBucketAssessment drift = normalize(RiskBucket.DRIFT, assessment.getDrift(), diagnostics);
        RiskBucketAssessment intent = assessment.getIntent() != null
                ? normalize(RiskBucket.INTENT, assessment.getIntent(), diagnostics)
                : null;
        RiskBucketAssessment operations = normalize(RiskBucket.OPERATIONS, assessment.getOperations(), diagnostics);

        List<RiskBucket> failed = new ArrayList<>();
        if (fails(drift, thresholds.forBucket(RiskBucket.DRIFT))) {
            failed.add(RiskBucket.DRIFT);
        }
        if (intent != null && fails(intent, thresholds.forBucket(RiskBucket.INTENT))) {
            failed.add(RiskBucket.INTENT);
        }
        if (fails(operations, thresholds.forBucket(RiskBucket.OPERATIONS))) {
            failed.add(RiskBucket.OPERATIONS);
        }

        RiskAssessment normalized = RiskAssessment.builder()
                .drift(drift)
                .intent(intent)
                .operations(operations)
                .build();
        return new BucketEvaluation(failed.isEmpty(), List.copyOf(failed), normalized);
    }

    public BucketEvaluation evaluate(RiskAssessment assessment, BucketThresholds thresholds) {
        return evaluate(assessment, thresholds, new EvaluationDiagnostics());
    }

    public static boolean exceeds(RiskLevel risk, RiskLevel threshold) {
        return risk.meetsOrExceeds(threshold);
    }

    /**
     * Lowercases the reported level and falls back to low, with a warning, when it is not
     * one of low/medium/high.
     */
    static RiskLevel normalizeLevel(RiskBucket bucket, String reported, EvaluationDiagnostics diagnostics) {
        RiskLevel level = RiskLevel.parse(reported);
        if (level == null) {
            diagnostics.warn(String.format("Invalid risk level '%s' for %s bucket; defaulting to low",
                    reported, bucket.getId()));
            return RiskLevel.LOW;
        }
        return level;
    }

    // A missing drift or operations bucket becomes a low placeholder.
    private RiskBucketAssessment normalize(RiskBucket bucket, RiskBucketAssessment reported,
                                           EvaluationDiagnostics diagnostics) {
        if (reported == null) {
            diagnostics.warn(String.format("Risk assessment has no %s bucket; treating it as low risk", bucket.getId()));
            return RiskBucketAssessment.placeholder(bucket, "No " + bucket.getId() + " assessment provided");
        }
        RiskLevel level = normalizeLevel(bucket, reported.getRiskLevel(), diagnostics);
        return reported.toBuilder()
                .bucket(bucket)
                .riskLevel(level.getId())
                .concerns(reported.getConcerns() != null ? new ArrayList<>(reported.getConcerns()) : List.of())
                .build();
    }

    private boolean fails(RiskBucketAssessment assessment, RiskLevel threshold) {
        RiskLevel effectiveThreshold = threshold != null ? threshold : RiskLevel.HIGH;
        return exceeds(RiskLevel.parse(assessment.getRiskLevel()), effectiveThreshold);
    }
}
