package com.infra.whatif.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infra.whatif.engine.EvaluationDiagnostics;
import com.infra.whatif.model.*;
import com.infra.whatif.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OracleResponseParserTest {

    private OracleResponseParser parser;
    private EvaluationDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        parser = new OracleResponseParser(new JsonBlockExtractor(new ObjectMapper()));
        diagnostics = new EvaluationDiagnostics();
    }

    @Test
    void parse_fullResponse() {
        String raw = TestDataFactory.oracleResponse("medium", "low", "high", "stapp:high", "kv:noise");

        ClassificationResult result = parser.parse(raw, diagnostics);

        assertThat(result.getResources()).hasSize(2);
        ChangeRecord first = result.getResources().get(0);
        assertThat(first.getName()).isEqualTo("stapp");
        assertThat(first.getType()).isEqualTo("Microsoft.Storage/storageAccounts");
        assertThat(first.getAction()).isEqualTo(ChangeAction.MODIFY);
        assertThat(first.getDescription()).isEqualTo("Change to stapp");
        assertThat(first.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(result.getResources().get(1).getConfidenceLevel()).isEqualTo(ConfidenceLevel.NOISE);

        assertThat(result.getOverallSummary()).isEqualTo("Summary");
        assertThat(result.getRiskAssessment().getDrift().getRiskLevel()).isEqualTo("medium");
        assertThat(result.getRiskAssessment().getIntent().getRiskLevel()).isEqualTo("low");
        assertThat(result.getRiskAssessment().getOperations().getBucket()).isEqualTo(RiskBucket.OPERATIONS);
        assertThat(result.getVerdict().getSafe()).isTrue();
        assertThat(result.getVerdict().getReasoning()).isEqualTo("Oracle reasoning");
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void parse_missingResourcesAndSummary_defaultsWithWarnings() {
        ClassificationResult result = parser.parse("{\"risk_assessment\": {}}", diagnostics);

        assertThat(result.getResources()).isEmpty();
        assertThat(result.getOverallSummary()).isEqualTo(OracleResponseParser.NO_SUMMARY);
        assertThat(result.getRiskAssessment()).isNull();
        assertThat(diagnostics.getWarnings()).hasSize(2);
    }

    @Test
    void parse_unknownConfidence_defaultsToMediumWithWarning() {
        String raw = "{\"resources\": [{\"resource_name\": \"a\", \"confidence_level\": \"certain\"},"
                + " {\"resource_name\": \"b\"}], \"overall_summary\": \"s\"}";

        ClassificationResult result = parser.parse(raw, diagnostics);

        assertThat(result.getResources()).extracting(ChangeRecord::getConfidenceLevel)
                .containsExactly(ConfidenceLevel.MEDIUM, ConfidenceLevel.MEDIUM);
        assertThat(diagnostics.getWarnings()).containsExactly(
                "Unrecognized confidence 'certain' for resource a; defaulting to medium");
    }

    @Test
    void parse_confidenceIsCaseInsensitive() {
        String raw = "{\"resources\": [{\"resource_name\": \"a\", \"confidence_level\": \"Noise\"}],"
                + " \"overall_summary\": \"s\"}";

        ClassificationResult result = parser.parse(raw, diagnostics);

        assertThat(result.getResources().get(0).getConfidenceLevel()).isEqualTo(ConfidenceLevel.NOISE);
    }

    @Test
    void parse_recordRiskLevels() {
        String raw = "{\"resources\": ["
                + "{\"resource_name\": \"a\", \"risk_level\": \"none\"},"
                + "{\"resource_name\": \"b\", \"risk_level\": \"HIGH\", \"risk_reason\": \"public access\"},"
                + "{\"resource_name\": \"c\", \"risk_level\": \"critical\"}"
                + "], \"overall_summary\": \"s\"}";

        ClassificationResult result = parser.parse(raw, diagnostics);

        assertThat(result.getResources().get(0).getRiskLevel()).isNull();
        assertThat(result.getResources().get(1).getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getResources().get(1).getRiskReason()).isEqualTo("public access");
        assertThat(result.getResources().get(2).getRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void parse_unknownAction_absentWithWarning() {
        String raw = "{\"resources\": [{\"resource_name\": \"a\", \"action\": \"Replace\"},"
                + " {\"resource_name\": \"b\", \"action\": \"no change\"}], \"overall_summary\": \"s\"}";

        ClassificationResult result = parser.parse(raw, diagnostics);

        assertThat(result.getResources().get(0).getAction()).isNull();
        assertThat(result.getResources().get(1).getAction()).isEqualTo(ChangeAction.NO_CHANGE);
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void parse_bucketRiskLevelKeptAsReported() {
        String raw = "{\"resources\": [], \"overall_summary\": \"s\","
                + " \"risk_assessment\": {\"drift\": {\"risk_level\": \"Critical\", \"concerns\": [\"x\", 3, null, {}]}}}";

        ClassificationResult result = parser.parse(raw, diagnostics);

        RiskBucketAssessment drift = result.getRiskAssessment().getDrift();
        assertThat(drift.getRiskLevel()).isEqualTo("Critical");
        assertThat(drift.getConcerns()).containsExactly("x", "3");
        assertThat(result.getRiskAssessment().getIntent()).isNull();
        assertThat(result.getRiskAssessment().getOperations()).isNull();
    }

    @Test
    void parse_fallbackFieldNames() {
        String raw = "{\"resources\": [{\"name\": \"a\", \"type\": \"t\", \"description\": \"d\","
                + " \"confidence\": \"low\", \"confidence_rationale\": \"r\"}], \"overall_summary\": \"s\"}";

        ChangeRecord record = parser.parse(raw, diagnostics).getResources().get(0);

        assertThat(record.getName()).isEqualTo("a");
        assertThat(record.getType()).isEqualTo("t");
        assertThat(record.getDescription()).isEqualTo("d");
        assertThat(record.getConfidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
        assertThat(record.getConfidenceReason()).isEqualTo("r");
    }

    @Test
    void parse_unextractableResponse_throws() {
        assertThatThrownBy(() -> parser.parse("no json here", diagnostics))
                .isInstanceOf(OracleResponseException.class);
    }
}
