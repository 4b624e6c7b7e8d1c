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
@Schema(description = "A single proposed resource action with the classifier's commentary")
public class ChangeRecord {

    @Schema(description = "Short resource name", example = "stdiagprod01")
    private String name;

    @Schema(description = "Resource type, abbreviated for readability", example = "Storage Account")
    private String type;

    @Schema(description = "Planned action; absent when the classifier reported an unknown action", example = "Modify")
    private ChangeAction action;

    @Schema(description = "Plain-language description of the change",
            example = "Updates the minimum TLS version from 1.0 to 1.2.")
    private String description;

    @Schema(description = "Whether the change is a genuine effect (high/medium) or reporting noise (low/noise)", example = "high")
    private ConfidenceLevel confidenceLevel;

    @Schema(description = "Why the classifier assigned this confidence",
            example = "Property is explicitly changed in the template diff")
    private String confidenceReason;

    @Schema(description = "Per-change risk level, when the classifier supplied one", example = "medium")
    private RiskLevel riskLevel;

    @Schema(description = "Why this change is risky, if applicable")
    private String riskReason;
}
