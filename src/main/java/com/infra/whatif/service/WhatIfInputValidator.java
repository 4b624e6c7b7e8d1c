package com.infra.whatif.service;

import com.infra.whatif.config.RiskThresholdConfig;
import com.infra.whatif.engine.EvaluationDiagnostics;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prepares raw What-If output for the oracle: rejects empty input, truncates oversized
 * input and warns when the text does not look like What-If output at all.
 */
@Component
public class WhatIfInputValidator {

    private static final List<String> WHATIF_MARKERS = List.of(
            "Resource changes:",
            "+ Create",
            "~ Modify",
            "- Delete",
            "Resource and property changes",
            "Scope:");

    private final RiskThresholdConfig thresholdConfig;

    public WhatIfInputValidator(RiskThresholdConfig thresholdConfig) {
        this.thresholdConfig = thresholdConfig;
    }

    public String prepare(String content, EvaluationDiagnostics diagnostics) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("No What-If output received. Input is empty.");
        }

        int maxChars = thresholdConfig.getMaxInputChars();
        String prepared = content;
        if (prepared.length() > maxChars) {
            diagnostics.warn(String.format("Input truncated to %,d characters (original: %,d characters)",
                    maxChars, content.length()));
            prepared = prepared.substring(0, maxChars);
        }

        if (WHATIF_MARKERS.stream().noneMatch(prepared::contains)) {
            diagnostics.warn("Input may not be Azure What-If output: none of the expected markers "
                    + "(e.g. 'Resource changes:', '+ Create') were found. Proceeding anyway.");
        }
        return prepared;
    }
}
