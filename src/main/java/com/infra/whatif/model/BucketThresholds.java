package com.infra.whatif.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Minimum risk level per bucket that blocks deployment. Missing values fall back to the configured defaults.")
public class BucketThresholds {

    @Schema(description = "Drift threshold", example = "high")
    private RiskLevel drift;

    @Schema(description = "Intent alignment threshold", example = "high")
    private RiskLevel intent;

    @Schema(description = "Risky operations threshold", example = "high")
    private RiskLevel operations;

    public static BucketThresholds defaults() {
        return new BucketThresholds(RiskLevel.HIGH, RiskLevel.HIGH, RiskLevel.HIGH);
    }

    public RiskLevel forBucket(RiskBucket bucket) {
        return switch (bucket) {
            case DRIFT -> drift;
            case INTENT -> intent;
            case OPERATIONS -> operations;
        };
    }

    /**
     * Fills every missing level in {@code overrides} from this instance.
     */
    public BucketThresholds overriddenBy(BucketThresholds overrides) {
        if (overrides == null) {
            return new BucketThresholds(drift, intent, operations);
        }
        return new BucketThresholds(
                overrides.getDrift() != null ? overrides.getDrift() : drift,
                overrides.getIntent() != null ? overrides.getIntent() : intent,
                overrides.getOperations() != null ? overrides.getOperations() : operations);
    }
}
