package com.infra.whatif.engine;

import com.infra.whatif.model.ChangeRecord;
import com.infra.whatif.model.ConfidenceLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Marks change records as noise when their description is close to a user-supplied
 * noise phrase. Matching is case-insensitive and fuzzy (see {@link SimilarityRatio}).
 */
@Component
public class NoisePatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(NoisePatternMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.80;

    /**
     * @return true if any pattern's similarity ratio with {@code text} is at least
     *         {@code threshold}; false for empty text or an empty pattern list
     */
    public boolean match(String text, List<String> patterns, double threshold) {
        if (text == null || text.isEmpty() || patterns == null || patterns.isEmpty()) {
            return false;
        }
        String candidate = text.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (pattern == null || pattern.isEmpty()) {
                continue;
            }
            if (SimilarityRatio.of(candidate, pattern.toLowerCase(Locale.ROOT)) >= threshold) {
                return true;
            }
        }
        return false;
    }

    public boolean match(String text, List<String> patterns) {
        return match(text, patterns, DEFAULT_THRESHOLD);
    }

    /**
     * Returns the records with confidence overridden to {@link ConfidenceLevel#NOISE}
     * wherever the description matches a pattern. Records are never dropped and the
     * input list is left untouched.
     */
    public List<ChangeRecord> apply(List<ChangeRecord> records, List<String> patterns, double threshold) {
        if (records == null) {
            return List.of();
        }
        if (patterns == null || patterns.isEmpty()) {
            return new ArrayList<>(records);
        }

        List<ChangeRecord> result = new ArrayList<>(records.size());
        int overridden = 0;
        for (ChangeRecord record : records) {
            if (record.getConfidenceLevel() != ConfidenceLevel.NOISE
                    && match(record.getDescription(), patterns, threshold)) {
                result.add(record.toBuilder()
                        .confidenceLevel(ConfidenceLevel.NOISE)
                        .confidenceReason("Matched noise pattern")
                        .build());
                overridden++;
                log.debug("Noise pattern matched resource={} description='{}'",
                        record.getName(), record.getDescription());
            } else {
                result.add(record);
            }
        }

        if (overridden > 0) {
            log.info("Noise patterns marked {} of {} changes as noise", overridden, records.size());
        }
        return result;
    }
}
