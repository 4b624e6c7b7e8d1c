package com.infra.whatif.engine;

import com.infra.whatif.model.ClassificationResult;

/**
 * @param included high/medium confidence changes, carrying the summary-level data
 * @param excluded low/noise confidence changes with an empty summary
 */
public record ConfidenceSplit(ClassificationResult included, ClassificationResult excluded) {

    public boolean hasExcluded() {
        return excluded.getResources() != null && !excluded.getResources().isEmpty();
    }
}
