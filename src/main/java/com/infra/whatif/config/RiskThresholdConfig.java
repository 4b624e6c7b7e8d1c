package com.infra.whatif.config;

import com.infra.whatif.model.BucketThresholds;
import com.infra.whatif.model.RiskLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskThresholdConfig {

    // Minimum risk level per bucket that blocks deployment (inclusive).
    private RiskLevel driftThreshold = RiskLevel.HIGH;
    private RiskLevel intentThreshold = RiskLevel.HIGH;
    private RiskLevel operationsThreshold = RiskLevel.HIGH;

    // Similarity ratio at which a change description counts as matching a noise phrase.
    private double noiseMatchThreshold = 0.80;

    // Default noise pattern file applied when a request names none. Empty = no default.
    private String noisePatternFile;

    // Directory of pattern files a request may select by name. Empty = requests cannot name a file.
    private String noisePatternDir;

    // What-If input beyond this many characters is truncated with a warning.
    private int maxInputChars = 100_000;

    /**
     * Thresholds as one consistent set. Evaluations read this once per request.
     */
    public record Snapshot(BucketThresholds thresholds, double noiseMatchThreshold) {}

    public synchronized Snapshot snapshot() {
        return new Snapshot(new BucketThresholds(driftThreshold, intentThreshold, operationsThreshold),
                noiseMatchThreshold);
    }

    /**
     * Replaces all runtime-adjustable thresholds at once, so no reader sees a partial update.
     */
    public synchronized void updateThresholds(RiskLevel drift, RiskLevel intent, RiskLevel operations,
                                              double noiseMatch) {
        this.driftThreshold = drift;
        this.intentThreshold = intent;
        this.operationsThreshold = operations;
        this.noiseMatchThreshold = noiseMatch;
    }
}
