package com.infra.whatif.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.infra.whatif.engine.EvaluationDiagnostics;
import com.infra.whatif.model.ChangeAction;
import com.infra.whatif.model.ChangeRecord;
import com.infra.whatif.model.ClassificationResult;
import com.infra.whatif.model.ConfidenceLevel;
import com.infra.whatif.model.OracleVerdict;
import com.infra.whatif.model.RiskAssessment;
import com.infra.whatif.model.RiskBucket;
import com.infra.whatif.model.RiskBucketAssessment;
import com.infra.whatif.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw oracle response into a {@link ClassificationResult}.
 *
 * Extraction failure is the only fatal outcome. Missing or malformed fields get a
 * default and a warning on the diagnostics channel:
 * missing resources become an empty list, unknown confidence becomes medium,
 * unknown per-change risk becomes low. Bucket risk levels are kept as reported;
 * they are normalized by the bucket evaluator.
 */
@Component
public class OracleResponseParser {

    static final String NO_SUMMARY = "No summary provided.";

    private final JsonBlockExtractor extractor;

    public OracleResponseParser(JsonBlockExtractor extractor) {
        this.extractor = extractor;
    }

    public ClassificationResult parse(String rawResponse, EvaluationDiagnostics diagnostics) {
        JsonNode root = extractor.extract(rawResponse);

        List<ChangeRecord> resources = new ArrayList<>();
        JsonNode resourcesNode = root.get("resources");
        if (resourcesNode == null || !resourcesNode.isArray()) {
            diagnostics.warn("Oracle response missing 'resources' field; using empty list");
        } else {
            for (JsonNode node : resourcesNode) {
                if (node.isObject()) {
                    resources.add(parseRecord(node, diagnostics));
                }
            }
        }

        String summary = text(root, "overall_summary");
        if (summary == null) {
            diagnostics.warn("Oracle response missing 'overall_summary' field");
            summary = NO_SUMMARY;
        }

        return ClassificationResult.builder()
                .resources(resources)
                .overallSummary(summary)
                .riskAssessment(parseRiskAssessment(root.get("risk_assessment")))
                .verdict(parseVerdict(root.get("verdict")))
                .build();
    }

    private ChangeRecord parseRecord(JsonNode node, EvaluationDiagnostics diagnostics) {
        String name = firstText(node, "resource_name", "name");

        String rawAction = text(node, "action");
        ChangeAction action = ChangeAction.parse(rawAction);
        if (action == null && rawAction != null) {
            diagnostics.warn(String.format("Unrecognized action '%s' for resource %s", rawAction, name));
        }

        String rawConfidence = firstText(node, "confidence_level", "confidence");
        ConfidenceLevel confidence = ConfidenceLevel.parse(rawConfidence);
        if (confidence == null) {
            if (rawConfidence != null) {
                diagnostics.warn(String.format("Unrecognized confidence '%s' for resource %s; defaulting to medium",
                        rawConfidence, name));
            }
            confidence = ConfidenceLevel.MEDIUM;
        }

        return ChangeRecord.builder()
                .name(name)
                .type(firstText(node, "resource_type", "type"))
                .action(action)
                .description(firstText(node, "summary", "description"))
                .confidenceLevel(confidence)
                .confidenceReason(firstText(node, "confidence_reason", "confidence_rationale"))
                .riskLevel(parseRecordRisk(text(node, "risk_level"), name, diagnostics))
                .riskReason(text(node, "risk_reason"))
                .build();
    }

    // "none" and missing both mean the change carries no risk rating.
    private RiskLevel parseRecordRisk(String raw, String name, EvaluationDiagnostics diagnostics) {
        if (raw == null || raw.isBlank() || "none".equalsIgnoreCase(raw.trim())) {
            return null;
        }
        RiskLevel level = RiskLevel.parse(raw);
        if (level == null) {
            diagnostics.warn(String.format("Invalid risk level '%s' for resource %s; defaulting to low", raw, name));
            return RiskLevel.LOW;
        }
        return level;
    }

    private RiskAssessment parseRiskAssessment(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            return null;
        }
        RiskAssessment assessment = RiskAssessment.builder()
                .drift(parseBucket(RiskBucket.DRIFT, node.get("drift")))
                .intent(parseBucket(RiskBucket.INTENT, node.get("intent")))
                .operations(parseBucket(RiskBucket.OPERATIONS, node.get("operations")))
                .build();
        return assessment.isEmpty() ? null : assessment;
    }

    private RiskBucketAssessment parseBucket(RiskBucket bucket, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<String> concerns = new ArrayList<>();
        JsonNode concernsNode = node.get("concerns");
        if (concernsNode != null && concernsNode.isArray()) {
            for (JsonNode concern : concernsNode) {
                if (concern.isValueNode() && !concern.isNull()) {
                    concerns.add(concern.asText());
                }
            }
        }
        return RiskBucketAssessment.builder()
                .bucket(bucket)
                .riskLevel(text(node, "risk_level"))
                .concerns(concerns)
                .reasoning(text(node, "reasoning"))
                .build();
    }

    private OracleVerdict parseVerdict(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode safe = node.get("safe");
        return OracleVerdict.builder()
                .safe(safe != null && safe.isBoolean() ? safe.booleanValue() : null)
                .overallRiskLevel(firstText(node, "overall_risk_level", "risk_level"))
                .highestRiskBucket(text(node, "highest_risk_bucket"))
                .reasoning(text(node, "reasoning"))
                .build();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }
}
