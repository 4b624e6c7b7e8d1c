package com.infra.whatif.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infra.whatif.engine.EvaluationState;
import com.infra.whatif.model.*;
import com.infra.whatif.oracle.OracleException;
import com.infra.whatif.oracle.OracleResponseException;
import com.infra.whatif.oracle.OracleTimeoutException;
import com.infra.whatif.service.DeploymentEvaluationService;
import com.infra.whatif.service.NoisePatternSourceException;
import com.infra.whatif.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EvaluationController.class)
class EvaluationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DeploymentEvaluationService evaluationService;

    private static EvaluationResult blockedResult() {
        return EvaluationResult.builder()
                .verdict(Verdict.builder()
                        .safe(false)
                        .highestRiskBucket("drift")
                        .overallRiskLevel(RiskLevel.HIGH)
                        .reasoning("Deployment blocked: failed risk buckets: drift.")
                        .failedBuckets(List.of(RiskBucket.DRIFT))
                        .build())
                .riskAssessment(TestDataFactory.createAssessment("high", "low"))
                .overallSummary("Summary")
                .includedChanges(List.of(TestDataFactory.createChange("stapp", ConfidenceLevel.HIGH, "TLS change")))
                .excludedChanges(List.of(TestDataFactory.createChange("tags", ConfidenceLevel.NOISE, "Tag change")))
                .reclassified(true)
                .stateTrail(List.of(EvaluationState.CLASSIFIED, EvaluationState.VERDICT))
                .warnings(List.of())
                .evaluatedAt(System.currentTimeMillis())
                .build();
    }

    @Test
    void evaluate_success() throws Exception {
        when(evaluationService.evaluate(any())).thenReturn(blockedResult());

        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                TestDataFactory.createRequest(TestDataFactory.whatIfOutput()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict.safe").value(false))
                .andExpect(jsonPath("$.verdict.highestRiskBucket").value("drift"))
                .andExpect(jsonPath("$.verdict.overallRiskLevel").value("high"))
                .andExpect(jsonPath("$.verdict.failedBuckets[0]").value("drift"))
                .andExpect(jsonPath("$.riskAssessment.drift.riskLevel").value("high"))
                .andExpect(jsonPath("$.includedChanges[0].action").value("Modify"))
                .andExpect(jsonPath("$.excludedChanges[0].confidenceLevel").value("noise"))
                .andExpect(jsonPath("$.reclassified").value(true))
                .andExpect(jsonPath("$.stateTrail[0]").value("CLASSIFIED"));
    }

    @Test
    void evaluate_requestFieldsBound() throws Exception {
        when(evaluationService.evaluate(any())).thenReturn(blockedResult());

        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "whatIfContent", "Resource changes: 1 to modify.",
                                "prTitle", "Enable TLS",
                                "noisePatterns", List.of("tag change"),
                                "thresholds", Map.of("drift", "medium")
                        ))))
                .andExpect(status().isOk());

        verify(evaluationService).evaluate(argThat(request ->
                request.getThresholds().getDrift() == RiskLevel.MEDIUM
                        && request.getThresholds().getOperations() == null
                        && request.hasIntentContext()
                        && request.getNoisePatterns().equals(List.of("tag change"))));
    }

    @Test
    void evaluate_blankWhatIfContent_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"whatIfContent\": \"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.field").value("whatIfContent"));

        verifyNoInteractions(evaluationService);
    }

    @Test
    void evaluate_invalidThresholdValue_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"whatIfContent\": \"x\", \"thresholds\": {\"drift\": \"critical\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void evaluate_oracleUnavailable_returns502() throws Exception {
        when(evaluationService.evaluate(any())).thenThrow(new OracleException("Cannot reach anthropic"));

        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"whatIfContent\": \"x\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("ORACLE_UNAVAILABLE"))
                .andExpect(jsonPath("$.error").value("Cannot reach anthropic"));
    }

    @Test
    void evaluate_oracleResponseInvalid_returns502WithPreview() throws Exception {
        when(evaluationService.evaluate(any())).thenThrow(
                new OracleResponseException("Could not extract valid JSON from oracle response", "no json"));

        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"whatIfContent\": \"x\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("ORACLE_RESPONSE_INVALID"))
                .andExpect(jsonPath("$.responsePreview").value("no json"));
    }

    @Test
    void evaluate_oracleTimeout_returns504() throws Exception {
        when(evaluationService.evaluate(any())).thenThrow(
                new OracleTimeoutException("anthropic call timed out after PT2M", null));

        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"whatIfContent\": \"x\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("ORACLE_TIMEOUT"));
    }

    @Test
    void evaluate_unreadablePatternFile_returns422() throws Exception {
        when(evaluationService.evaluate(any())).thenThrow(
                new NoisePatternSourceException("/missing.txt", new IOException("No such file")));

        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"whatIfContent\": \"x\", \"noisePatternFile\": \"/missing.txt\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.field").value("noisePatternFile"));
    }

    @Test
    void evaluate_outOfRangeNoiseThreshold_returns400() throws Exception {
        when(evaluationService.evaluate(any())).thenThrow(
                new IllegalArgumentException("noiseMatchThreshold must be in [0, 1]"));

        mockMvc.perform(post("/api/v1/deployments/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"whatIfContent\": \"x\", \"noiseMatchThreshold\": 2.0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("noiseMatchThreshold must be in [0, 1]"));
    }
}
