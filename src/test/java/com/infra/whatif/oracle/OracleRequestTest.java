package com.infra.whatif.oracle;

import com.infra.whatif.model.ChangeAction;
import com.infra.whatif.model.ChangeRecord;
import com.infra.whatif.model.ConfidenceLevel;
import com.infra.whatif.model.EvaluationRequest;
import com.infra.whatif.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OracleRequestTest {

    @Test
    void from_withoutPullRequest_noIntentSection() {
        OracleRequest request = OracleRequest.from(TestDataFactory.createRequest("raw"), "raw");

        assertThat(request.hasIntentContext()).isFalse();
        assertThat(request.toUserMessage())
                .contains("<whatif_output>\nraw\n</whatif_output>")
                .doesNotContain("<pull_request_intent>")
                .doesNotContain("<code_diff>");
    }

    @Test
    void from_withContext_includesAllSections() {
        EvaluationRequest source = EvaluationRequest.builder()
                .whatIfContent("raw")
                .prTitle("Enable TLS")
                .diffContent("+ tls")
                .sourceContent("resource st 'x'")
                .build();

        String message = OracleRequest.from(source, "raw").toUserMessage();

        assertThat(message)
                .contains("Title: Enable TLS")
                .contains("Description: Not provided")
                .contains("<code_diff>\n+ tls\n</code_diff>")
                .contains("<template_source>");
    }

    @Test
    void forReclassification_listsRetainedChanges() {
        ChangeRecord keyVault = TestDataFactory.createChange("kv", ConfidenceLevel.HIGH, "Enable purge protection");
        ChangeRecord unknown = TestDataFactory.createChange("st", ConfidenceLevel.MEDIUM, "Rotate keys");
        unknown.setAction(null);
        OracleRequest original = OracleRequest.builder().primaryPayload("raw").prTitle("t").build();

        OracleRequest second = original.forReclassification(List.of(keyVault, unknown));

        assertThat(second.isReclassification()).isTrue();
        assertThat(second.getPrTitle()).isEqualTo("t");
        assertThat(second.getPrimaryPayload()).isEqualTo("Retained changes:\n"
                + "- Modify kv (Microsoft.Storage/storageAccounts): Enable purge protection\n"
                + "- Unknown st (Microsoft.Storage/storageAccounts): Rotate keys\n");
        assertThat(second.toUserMessage()).contains("<retained_changes>").doesNotContain("<whatif_output>");
        assertThat(original.isReclassification()).isFalse();
        assertThat(keyVault.getAction()).isEqualTo(ChangeAction.MODIFY);
    }

    @Test
    void forReclassification_keepsRawBlocksOfRetainedResourcesOnly() {
        ChangeRecord storage = TestDataFactory.createChange("stapp", ConfidenceLevel.HIGH, "TLS change");
        OracleRequest original = OracleRequest.from(
                TestDataFactory.createRequest(TestDataFactory.whatIfOutputWithTags()),
                TestDataFactory.whatIfOutputWithTags());

        String payload = original.forReclassification(List.of(storage)).getPrimaryPayload();

        assertThat(payload)
                .contains("Scope: /subscriptions/0000/resourceGroups/rg-app")
                .contains("  ~ Microsoft.Storage/storageAccounts/stapp [2023-01-01]")
                .contains("properties.minimumTlsVersion")
                .doesNotContain("Microsoft.Resources/tags/tags")
                .doesNotContain("costCenter")
                .doesNotContain("Resource changes:")
                .doesNotContain("Retained changes:");
    }

    @Test
    void forReclassification_recordWithoutBlock_fallsBackToDescriptions() {
        ChangeRecord storage = TestDataFactory.createChange("stapp", ConfidenceLevel.HIGH, "TLS change");
        ChangeRecord vault = TestDataFactory.createChange("kv", ConfidenceLevel.HIGH, "Enable purge protection");
        OracleRequest original = OracleRequest.builder().primaryPayload(TestDataFactory.whatIfOutput()).build();

        String payload = original.forReclassification(List.of(storage, vault)).getPrimaryPayload();

        assertThat(payload)
                .startsWith("Retained changes:\n")
                .contains("- Modify kv (Microsoft.Storage/storageAccounts): Enable purge protection")
                .doesNotContain("minimumTlsVersion");
    }
}
