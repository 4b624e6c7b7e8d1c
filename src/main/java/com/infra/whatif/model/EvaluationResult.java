package com.infra.whatif.model;

import com.infra.whatif.engine.EvaluationState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of evaluating a deployment: verdict plus the changes it was computed from")
public class EvaluationResult {

    @Schema(description = "Final safety verdict")
    private Verdict verdict;

    @Schema(description = "Normalized per-bucket risk assessment the verdict was computed from")
    private RiskAssessment riskAssessment;

    @Schema(description = "Overall narrative for the retained changes")
    private String overallSummary;

    @Schema(description = "High and medium confidence changes that took part in risk evaluation")
    private List<ChangeRecord> includedChanges;

    @Schema(description = "Low confidence and noise changes; informational only, never affect the verdict")
    private List<ChangeRecord> excludedChanges;

    @Schema(description = "True when a second classifier pass over the retained changes replaced the first pass's risk data")
    private boolean reclassified;

    @Schema(description = "Pipeline states the evaluation passed through")
    private List<EvaluationState> stateTrail;

    @Schema(description = "Non-fatal conditions encountered during evaluation")
    private List<String> warnings;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    private long evaluatedAt;
}
