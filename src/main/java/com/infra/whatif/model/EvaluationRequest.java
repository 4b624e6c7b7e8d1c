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
@Schema(description = "A What-If report submitted for deployment safety evaluation")
public class EvaluationRequest {

    @Schema(description = "Raw Azure What-If output", requiredMode = Schema.RequiredMode.REQUIRED)
    private String whatIfContent;

    @Schema(description = "Source diff that produced the changes")
    private String diffContent;

    @Schema(description = "Template source files for additional context")
    private String sourceContent;

    @Schema(description = "Pull request title; enables the intent bucket", example = "Enable TLS 1.2 on storage")
    private String prTitle;

    @Schema(description = "Pull request description; enables the intent bucket")
    private String prDescription;

    @Schema(description = "Inline noise phrases matched against change descriptions")
    private List<String> noisePatterns;

    @Schema(description = "Name of a newline-delimited noise pattern file inside the configured risk.noise-pattern-dir",
            example = "platform-noise.txt")
    private String noisePatternFile;

    @Schema(description = "Similarity ratio (0-1) at which a description counts as noise. Defaults to risk.noise-match-threshold.",
            example = "0.8")
    private Double noiseMatchThreshold;

    @Schema(description = "Per-request threshold overrides")
    private BucketThresholds thresholds;

    public boolean hasIntentContext() {
        return (prTitle != null && !prTitle.isBlank())
                || (prDescription != null && !prDescription.isBlank());
    }
}
