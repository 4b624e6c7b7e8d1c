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
@Schema(description = "Classifier assessment of a single risk bucket")
public class RiskBucketAssessment {

    @Schema(description = "Bucket identifier", example = "drift")
    private RiskBucket bucket;

    // Kept as reported by the classifier; RiskBucketEvaluator normalizes it to low/medium/high.
    @Schema(description = "Risk level of the bucket", example = "medium", allowableValues = {"low", "medium", "high"})
    private String riskLevel;

    @Schema(description = "Specific concerns raised for this bucket")
    private List<String> concerns;

    @Schema(description = "Reasoning behind the bucket's risk level")
    private String reasoning;

    public static RiskBucketAssessment placeholder(RiskBucket bucket, String reasoning) {
        return RiskBucketAssessment.builder()
                .bucket(bucket)
                .riskLevel(RiskLevel.LOW.getId())
                .concerns(List.of())
                .reasoning(reasoning)
                .build();
    }
}
