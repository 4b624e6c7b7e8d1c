package com.infra.whatif.model;

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
@Schema(description = "Final deployment safety determination")
public class Verdict {

    @Schema(description = "True when no risk bucket met or exceeded its threshold", example = "false")
    private boolean safe;

    @Schema(description = "Failed bucket with the highest risk level, or none when every bucket passed",
            example = "drift", allowableValues = {"drift", "intent", "operations", "none"})
    private String highestRiskBucket;

    @Schema(description = "Highest risk level across all evaluated buckets", example = "high")
    private RiskLevel overallRiskLevel;

    @Schema(description = "Explanation of the verdict")
    private String reasoning;

    @Schema(description = "Buckets that met or exceeded their threshold, in drift/intent/operations order")
    private List<RiskBucket> failedBuckets;
}
