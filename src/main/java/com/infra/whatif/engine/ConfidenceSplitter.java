package com.infra.whatif.engine;

import com.infra.whatif.model.ChangeRecord;
import com.infra.whatif.model.ClassificationResult;
import com.infra.whatif.model.ConfidenceLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stable partition of classified changes by confidence. Only the included side keeps
 * the overall summary, risk assessment and verdict; the excluded side is informational
 * and must never feed risk computation.
 */
@Component
public class ConfidenceSplitter {

    public ConfidenceSplit split(ClassificationResult classification) {
        List<ChangeRecord> included = new ArrayList<>();
        List<ChangeRecord> excluded = new ArrayList<>();

        List<ChangeRecord> resources = classification.getResources() != null
                ? classification.getResources()
                : List.of();
        for (ChangeRecord record : resources) {
            if (isIncluded(record)) {
                included.add(record);
            } else {
                excluded.add(record);
            }
        }

        ClassificationResult includedResult = classification.toBuilder()
                .resources(List.copyOf(included))
                .build();
        ClassificationResult excludedResult = ClassificationResult.builder()
                .resources(List.copyOf(excluded))
                .overallSummary("")
                .build();

        return new ConfidenceSplit(includedResult, excludedResult);
    }

    // Missing confidence counts as medium; the parser normally fills it in already.
    private boolean isIncluded(ChangeRecord record) {
        ConfidenceLevel level = record.getConfidenceLevel();
        return level == null || level.isIncluded();
    }
}
