package com.infra.whatif.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-bucket risk assessment. Intent is present only when pull request context was supplied.")
public class RiskAssessment {

    @Schema(description = "Infrastructure drift bucket")
    private RiskBucketAssessment drift;

    @Schema(description = "Pull request intent alignment bucket; absent when not evaluated", nullable = true)
    private RiskBucketAssessment intent;

    @Schema(description = "Risky operations bucket")
    private RiskBucketAssessment operations;

    public boolean isEmpty() {
        return drift == null && intent == null && operations == null;
    }
}
