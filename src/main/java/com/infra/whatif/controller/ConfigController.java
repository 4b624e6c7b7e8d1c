package com.infra.whatif.controller;

import com.infra.whatif.config.OracleConfig;
import com.infra.whatif.config.RiskThresholdConfig;
import com.infra.whatif.model.RiskLevel;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (risk thresholds, oracle)")
public class ConfigController {

    private final RiskThresholdConfig thresholdConfig;
    private final OracleConfig oracleConfig;

    public ConfigController(RiskThresholdConfig thresholdConfig, OracleConfig oracleConfig) {
        this.thresholdConfig = thresholdConfig;
        this.oracleConfig = oracleConfig;
    }

    // ── Thresholds ──

    @Operation(summary = "Get risk bucket thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        RiskThresholdConfig.Snapshot current = thresholdConfig.snapshot();
        return ResponseEntity.ok(Map.of(
                "drift", current.thresholds().getDrift().getId(),
                "intent", current.thresholds().getIntent().getId(),
                "operations", current.thresholds().getOperations().getId(),
                "noiseMatchThreshold", current.noiseMatchThreshold()
        ));
    }

    @Operation(summary = "Update risk bucket thresholds",
            description = "A bucket fails when its risk level is at or above its threshold (low, medium or high). " +
                    "Changes apply immediately but reset on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        RiskThresholdConfig.Snapshot current = thresholdConfig.snapshot();
        RiskLevel drift = toRiskLevel(body, "drift", current.thresholds().getDrift());
        RiskLevel intent = toRiskLevel(body, "intent", current.thresholds().getIntent());
        RiskLevel operations = toRiskLevel(body, "operations", current.thresholds().getOperations());
        double noiseMatch = toDouble(body, "noiseMatchThreshold", current.noiseMatchThreshold());

        if (drift == null) return badRequest("drift must be one of low, medium, high", "drift");
        if (intent == null) return badRequest("intent must be one of low, medium, high", "intent");
        if (operations == null) return badRequest("operations must be one of low, medium, high", "operations");
        if (Double.isNaN(noiseMatch) || noiseMatch < 0 || noiseMatch > 1) {
            return badRequest("noiseMatchThreshold must be in [0, 1]", "noiseMatchThreshold");
        }

        thresholdConfig.updateThresholds(drift, intent, operations, noiseMatch);

        return getThresholds();
    }

    // ── Oracle (read-only) ──

    @Operation(summary = "Get classification oracle settings (read-only)")
    @GetMapping("/oracle")
    public ResponseEntity<Map<String, Object>> getOracleInfo() {
        // LinkedHashMap: model, base URL and deployment may be unset
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("provider", oracleConfig.getProvider());
        info.put("model", oracleConfig.getModel());
        info.put("baseUrl", oracleConfig.getBaseUrl());
        info.put("deployment", oracleConfig.getDeployment());
        info.put("timeoutSeconds", oracleConfig.getTimeout().toSeconds());
        return ResponseEntity.ok(info);
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private RiskLevel toRiskLevel(Map<String, Object> body, String key, RiskLevel defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        return RiskLevel.parse(v.toString());
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }
}
