package com.infra.whatif.engine;

import com.infra.whatif.model.BucketThresholds;
import com.infra.whatif.model.ClassificationResult;
import com.infra.whatif.model.EvaluationRequest;
import com.infra.whatif.model.Verdict;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Working state of a single deployment evaluation. Created per request and discarded
 * afterwards, so concurrent evaluations never share records.
 */
@Data
@Builder
public class EvaluationContext {

    private final EvaluationRequest request;

    // Request overrides merged over the configured defaults
    private final BucketThresholds thresholds;
    private final double noiseMatchThreshold;
    private final List<String> noisePatterns;

    private final EvaluationDiagnostics diagnostics;

    @Builder.Default
    private final List<EvaluationState> stateTrail = new ArrayList<>();

    // First oracle pass, after noise patterns have been applied
    private ClassificationResult classification;

    private ConfidenceSplit split;

    // Included side used for risk evaluation; replaced when re-classification succeeds
    private ClassificationResult evaluated;
    private boolean reclassified;

    private BucketEvaluation bucketEvaluation;
    private Verdict verdict;

    public void enter(EvaluationState state) {
        stateTrail.add(state);
    }
}
