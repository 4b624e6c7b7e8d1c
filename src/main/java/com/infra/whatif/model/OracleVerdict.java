package com.infra.whatif.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Verdict as proposed by the classifier. Only its reasoning is carried into the final
 * {@link Verdict}; safety is always decided by the bucket thresholds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Verdict proposed by the classification oracle")
public class OracleVerdict {

    @Schema(description = "Classifier's own safety call (informational)")
    private Boolean safe;

    @Schema(description = "Classifier's overall risk level, as reported", example = "medium")
    private String overallRiskLevel;

    @Schema(description = "Classifier's highest risk bucket, as reported", example = "operations")
    private String highestRiskBucket;

    @Schema(description = "Classifier's reasoning")
    private String reasoning;
}
