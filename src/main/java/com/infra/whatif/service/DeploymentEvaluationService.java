package com.infra.whatif.service;

import com.infra.whatif.config.MetricsConfig;
import com.infra.whatif.config.RiskThresholdConfig;
import com.infra.whatif.engine.ConfidenceSplit;
import com.infra.whatif.engine.ConfidenceSplitter;
import com.infra.whatif.engine.EvaluationContext;
import com.infra.whatif.engine.EvaluationDiagnostics;
import com.infra.whatif.engine.EvaluationState;
import com.infra.whatif.engine.NoisePatternMatcher;
import com.infra.whatif.engine.RiskBucketEvaluator;
import com.infra.whatif.model.ChangeRecord;
import com.infra.whatif.model.ClassificationResult;
import com.infra.whatif.model.EvaluationRequest;
import com.infra.whatif.model.EvaluationResult;
import com.infra.whatif.model.RiskAssessment;
import com.infra.whatif.model.RiskBucket;
import com.infra.whatif.model.RiskBucketAssessment;
import com.infra.whatif.model.Verdict;
import com.infra.whatif.oracle.ClassificationOracle;
import com.infra.whatif.oracle.OracleException;
import com.infra.whatif.oracle.OracleRequest;
import com.infra.whatif.oracle.OracleResponseParser;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Main orchestrator for deployment evaluation.
 *
 * Flow:
 * 1. CLASSIFIED     - first oracle pass over the What-If output (failure is fatal)
 * 2. NOISE_FILTERED - user noise phrases override confidence to noise
 * 3. SPLIT          - high/medium retained, low/noise excluded
 * 4. RECLASSIFIED   - only when something was excluded: second oracle pass over the
 *                     retained changes replaces the first pass's risk data; on failure
 *                     the first pass's data is kept and a warning is recorded
 * 5. EVALUATED      - risk buckets compared to thresholds
 * 6. VERDICT        - verdict assembled; excluded changes attached for information only
 */
@Service
public class DeploymentEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentEvaluationService.class);

    static final String NO_RETAINED_CHANGES = "No retained changes to assess";

    private final ClassificationOracle oracle;
    private final OracleResponseParser responseParser;
    private final NoisePatternMatcher noisePatternMatcher;
    private final ConfidenceSplitter confidenceSplitter;
    private final RiskBucketEvaluator riskBucketEvaluator;
    private final VerdictService verdictService;
    private final NoisePatternLoader noisePatternLoader;
    private final WhatIfInputValidator inputValidator;
    private final RiskThresholdConfig thresholdConfig;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public DeploymentEvaluationService(ClassificationOracle oracle,
                                       OracleResponseParser responseParser,
                                       NoisePatternMatcher noisePatternMatcher,
                                       ConfidenceSplitter confidenceSplitter,
                                       RiskBucketEvaluator riskBucketEvaluator,
                                       VerdictService verdictService,
                                       NoisePatternLoader noisePatternLoader,
                                       WhatIfInputValidator inputValidator,
                                       RiskThresholdConfig thresholdConfig,
                                       MetricsConfig metricsConfig,
                                       Tracer tracer) {
        this.oracle = oracle;
        this.responseParser = responseParser;
        this.noisePatternMatcher = noisePatternMatcher;
        this.confidenceSplitter = confidenceSplitter;
        this.riskBucketEvaluator = riskBucketEvaluator;
        this.verdictService = verdictService;
        this.noisePatternLoader = noisePatternLoader;
        this.inputValidator = inputValidator;
        this.thresholdConfig = thresholdConfig;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    /**
     * Evaluate a deployment. Either returns a fully assembled result or throws; no
     * partial verdict is ever produced.
     *
     * @throws OracleException              if the first classification pass fails
     * @throws NoisePatternSourceException  if a noise pattern file cannot be read
     * @throws IllegalArgumentException     on empty input or an out-of-range noise match threshold
     */
    @Observed(name = "deployment.evaluate", contextualName = "evaluate-deployment")
    public EvaluationResult evaluate(EvaluationRequest request) {
        EvaluationDiagnostics diagnostics = new EvaluationDiagnostics();

        // Inputs are validated and the pattern source read before spending an oracle call.
        String whatIfContent = inputValidator.prepare(request.getWhatIfContent(), diagnostics);
        RiskThresholdConfig.Snapshot configured = thresholdConfig.snapshot();
        EvaluationContext ctx = EvaluationContext.builder()
                .request(request)
                .thresholds(configured.thresholds().overriddenBy(request.getThresholds()))
                .noiseMatchThreshold(resolveNoiseMatchThreshold(request, configured))
                .noisePatterns(resolveNoisePatterns(request, diagnostics))
                .diagnostics(diagnostics)
                .build();
        OracleRequest oracleRequest = OracleRequest.from(request, whatIfContent);

        inStage(ctx, EvaluationState.CLASSIFIED, () -> classify(ctx, oracleRequest));
        inStage(ctx, EvaluationState.NOISE_FILTERED, () -> filterNoise(ctx));
        inStage(ctx, EvaluationState.SPLIT, () -> split(ctx));
        if (ctx.getSplit().hasExcluded()) {
            inStage(ctx, EvaluationState.RECLASSIFIED, () -> reclassify(ctx, oracleRequest));
        } else {
            ctx.setEvaluated(ctx.getSplit().included());
        }
        inStage(ctx, EvaluationState.EVALUATED, () -> evaluateBuckets(ctx));
        inStage(ctx, EvaluationState.VERDICT, () -> assembleVerdict(ctx));

        return EvaluationResult.builder()
                .verdict(ctx.getVerdict())
                .riskAssessment(ctx.getBucketEvaluation().normalizedAssessment())
                .overallSummary(ctx.getEvaluated().getOverallSummary())
                .includedChanges(ctx.getSplit().included().getResources())
                .excludedChanges(ctx.getSplit().excluded().getResources())
                .reclassified(ctx.isReclassified())
                .stateTrail(List.copyOf(ctx.getStateTrail()))
                .warnings(List.copyOf(diagnostics.getWarnings()))
                .evaluatedAt(System.currentTimeMillis())
                .build();
    }

    private void classify(EvaluationContext ctx, OracleRequest oracleRequest) {
        ClassificationResult first;
        try {
            String raw = oracle.classify(oracleRequest);
            first = responseParser.parse(raw, ctx.getDiagnostics());
        } catch (OracleException e) {
            log.error("Initial classification via {} failed: {}", oracle.getProviderName(), e.getMessage());
            throw e;
        }
        ctx.setClassification(withoutUnrequestedIntent(first, ctx));
        log.debug("Initial classification returned {} changes", ctx.getClassification().getResources().size());
    }

    private void filterNoise(EvaluationContext ctx) {
        List<String> patterns = ctx.getNoisePatterns();
        if (patterns == null) {
            return;
        }
        ClassificationResult classification = ctx.getClassification();
        List<ChangeRecord> filtered = noisePatternMatcher.apply(
                classification.getResources(), patterns, ctx.getNoiseMatchThreshold());
        ctx.setClassification(classification.toBuilder().resources(filtered).build());
    }

    private void split(EvaluationContext ctx) {
        ConfidenceSplit split = confidenceSplitter.split(ctx.getClassification());
        ctx.setSplit(split);

        int excludedCount = split.excluded().getResources().size();
        if (excludedCount > 0) {
            metricsConfig.recordNoiseFiltered(excludedCount);
        }
        log.info("Confidence split: {} retained, {} excluded",
                split.included().getResources().size(), excludedCount);
    }

    private void reclassify(EvaluationContext ctx, OracleRequest original) {
        ClassificationResult included = ctx.getSplit().included();

        if (included.getResources().isEmpty()) {
            // Nothing meaningful is left: the first pass's risk data only describes noise.
            log.info("All changes were excluded; skipping re-classification");
            ctx.setEvaluated(included.toBuilder()
                    .riskAssessment(RiskAssessment.builder()
                            .drift(RiskBucketAssessment.placeholder(RiskBucket.DRIFT, NO_RETAINED_CHANGES))
                            .operations(RiskBucketAssessment.placeholder(RiskBucket.OPERATIONS, NO_RETAINED_CHANGES))
                            .build())
                    .verdict(null)
                    .build());
            metricsConfig.recordReclassification("skipped");
            return;
        }

        try {
            String raw = oracle.classify(original.forReclassification(included.getResources()));
            ClassificationResult second = withoutUnrequestedIntent(
                    responseParser.parse(raw, ctx.getDiagnostics()), ctx);

            // Records stay as split; only the summary-level data is replaced.
            ctx.setEvaluated(included.toBuilder()
                    .overallSummary(second.getOverallSummary())
                    .riskAssessment(second.getRiskAssessment())
                    .verdict(second.getVerdict())
                    .build());
            ctx.setReclassified(true);
            metricsConfig.recordReclassification("success");
        } catch (OracleException e) {
            ctx.getDiagnostics().warn("Re-classification of retained changes failed (" + e.getMessage()
                    + "); falling back to first-pass risk assessment");
            ctx.setEvaluated(included);
            metricsConfig.recordReclassification("fallback");
        }
    }

    private void evaluateBuckets(EvaluationContext ctx) {
        ctx.setBucketEvaluation(riskBucketEvaluator.evaluate(
                ctx.getEvaluated().getRiskAssessment(), ctx.getThresholds(), ctx.getDiagnostics()));
    }

    private void assembleVerdict(EvaluationContext ctx) {
        Verdict verdict = verdictService.assemble(ctx.getBucketEvaluation(), ctx.getEvaluated().getVerdict());
        ctx.setVerdict(verdict);

        metricsConfig.recordVerdict(verdict.isSafe(), verdict.getOverallRiskLevel().getId());
        for (RiskBucket bucket : verdict.getFailedBuckets()) {
            metricsConfig.recordBucketFailed(bucket.getId());
        }

        if (!verdict.isSafe()) {
            log.warn("Deployment blocked: failedBuckets={}, highest={}, overallRisk={}",
                    verdict.getFailedBuckets(), verdict.getHighestRiskBucket(), verdict.getOverallRiskLevel());
        } else {
            log.info("Deployment safe: overallRisk={}", verdict.getOverallRiskLevel());
        }
    }

    /**
     * Intent is only assessed when pull request context was supplied; an intent bucket
     * in any other response is dropped rather than trusted.
     */
    private ClassificationResult withoutUnrequestedIntent(ClassificationResult result, EvaluationContext ctx) {
        RiskAssessment assessment = result.getRiskAssessment();
        if (ctx.getRequest().hasIntentContext() || assessment == null || assessment.getIntent() == null) {
            return result;
        }
        ctx.getDiagnostics().warn("Oracle returned an intent assessment without pull request context; ignoring it");
        RiskAssessment withoutIntent = assessment.toBuilder().intent(null).build();
        return result.toBuilder()
                .riskAssessment(withoutIntent.isEmpty() ? null : withoutIntent)
                .build();
    }

    /**
     * @return null when no pattern source was supplied (pass-through), otherwise the
     *         combined inline and file patterns
     */
    private List<String> resolveNoisePatterns(EvaluationRequest request, EvaluationDiagnostics diagnostics) {
        boolean namedFile = request.getNoisePatternFile() != null && !request.getNoisePatternFile().isBlank();
        String defaultFile = thresholdConfig.getNoisePatternFile();
        boolean hasFile = namedFile || (defaultFile != null && !defaultFile.isBlank());
        boolean hasInline = request.getNoisePatterns() != null;
        if (!hasFile && !hasInline) {
            return null;
        }

        List<String> patterns = new ArrayList<>();
        if (hasInline) {
            patterns.addAll(noisePatternLoader.parse(request.getNoisePatterns()));
        }
        if (namedFile) {
            patterns.addAll(noisePatternLoader.loadNamed(thresholdConfig.getNoisePatternDir(),
                    request.getNoisePatternFile()));
        } else if (hasFile) {
            patterns.addAll(noisePatternLoader.load(defaultFile));
        }
        if (patterns.isEmpty()) {
            diagnostics.warn("Noise pattern list is empty; no confidence overrides applied");
        }
        return patterns;
    }

    private double resolveNoiseMatchThreshold(EvaluationRequest request, RiskThresholdConfig.Snapshot configured) {
        double threshold = request.getNoiseMatchThreshold() != null
                ? request.getNoiseMatchThreshold()
                : configured.noiseMatchThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("noiseMatchThreshold must be in [0, 1]");
        }
        return threshold;
    }

    private void inStage(EvaluationContext ctx, EvaluationState state, Runnable stage) {
        Span span = tracer.nextSpan()
                .name("evaluation." + state.name().toLowerCase(Locale.ROOT))
                .tag("stage", state.name())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            stage.run();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
        // Only completed stages appear in the trail.
        ctx.enter(state);
    }
}
