package com.infra.whatif.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Change records plus the summary-level data returned by one classifier call")
public class ClassificationResult {

    @Schema(description = "Classified change records")
    private List<ChangeRecord> resources;

    @Schema(description = "Overall narrative of the deployment")
    private String overallSummary;

    @Schema(description = "Per-bucket risk assessment, when the classifier produced one", nullable = true)
    private RiskAssessment riskAssessment;

    @Schema(description = "Verdict proposed by the classifier, when present", nullable = true)
    private OracleVerdict verdict;
}
