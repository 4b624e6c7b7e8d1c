package com.infra.whatif.contract;

import com.infra.whatif.config.TestOracleConfig;
import com.infra.whatif.oracle.ClassificationOracle;
import com.infra.whatif.oracle.OracleException;
import com.infra.whatif.testutil.TestDataFactory;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Full request path through the real pipeline with only the oracle replaced.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestOracleConfig.class)
@ActiveProfiles("test")
class EvaluationFlowIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ClassificationOracle oracle;

    @Autowired
    private MeterRegistry meterRegistry;

    @BeforeEach
    void resetOracle() {
        Mockito.reset(oracle);
        when(oracle.getProviderName()).thenReturn("test");
    }

    @Test
    void evaluate_noiseExcludedAndReclassified() {
        when(oracle.classify(any())).thenReturn(
                TestDataFactory.oracleResponse("high", null, "low", "keyVaultPurgeProtection:high", "tags:medium"),
                TestDataFactory.oracleResponse("low", null, "low", "keyVaultPurgeProtection:high"));

        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/deployments/evaluate", Map.of(
                "whatIfContent", TestDataFactory.whatIfOutput(),
                "noisePatterns", List.of("Change to tags")), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.verdict.safe", Boolean.class)).isTrue();
        assertThat(json.read("$.verdict.highestRiskBucket", String.class)).isEqualTo("none");
        assertThat(json.read("$.reclassified", Boolean.class)).isTrue();
        assertThat(json.read("$.excludedChanges[0].confidenceLevel", String.class)).isEqualTo("noise");
        assertThat(json.read("$.stateTrail", List.class)).contains("RECLASSIFIED");
        assertThat(meterRegistry.find("reclassification.count").tag("outcome", "success").counter()).isNotNull();
    }

    @Test
    void evaluate_oracleFailure_returns502() {
        when(oracle.classify(any())).thenThrow(new OracleException("Cannot reach test"));

        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/deployments/evaluate",
                Map.of("whatIfContent", TestDataFactory.whatIfOutput()), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(JsonPath.parse(response.getBody()).read("$.code", String.class)).isEqualTo("ORACLE_UNAVAILABLE");
    }

    @Test
    void evaluate_serverPathAsPatternFile_rejectedWithoutOracleCall() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/deployments/evaluate", Map.of(
                "whatIfContent", TestDataFactory.whatIfOutput(),
                "noisePatternFile", "/etc/passwd"), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(JsonPath.parse(response.getBody()).read("$.code", String.class)).isEqualTo("INVALID_REQUEST");
        verify(oracle, never()).classify(any());
    }
}
