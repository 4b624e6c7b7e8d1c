package com.infra.whatif.oracle;

import com.infra.whatif.model.ChangeRecord;
import com.infra.whatif.model.EvaluationRequest;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What is sent to the classification oracle: the primary change description plus
 * optional supplementary context.
 */
@Value
@Builder(toBuilder = true)
public class OracleRequest {

    String primaryPayload;
    String diffContent;
    String sourceContent;
    String prTitle;
    String prDescription;

    // True for the second pass, whose payload holds only the retained changes
    boolean reclassification;

    public static OracleRequest from(EvaluationRequest request, String whatIfContent) {
        return OracleRequest.builder()
                .primaryPayload(whatIfContent)
                .diffContent(request.getDiffContent())
                .sourceContent(request.getSourceContent())
                .prTitle(request.getPrTitle())
                .prDescription(request.getPrDescription())
                .build();
    }

    /**
     * Second-pass request built only from the retained changes, so excluded noise cannot
     * leak back into the risk reasoning. The payload is the raw What-If blocks of those
     * changes; when a block cannot be located, it is the list of retained change
     * descriptions instead. Supplementary context is carried over unchanged.
     */
    public OracleRequest forReclassification(List<ChangeRecord> retained) {
        String blocks = WhatIfResourceBlocks.retain(primaryPayload, retained);
        return toBuilder()
                .primaryPayload(blocks != null ? blocks : describe(retained))
                .reclassification(true)
                .build();
    }

    private static String describe(List<ChangeRecord> retained) {
        StringBuilder payload = new StringBuilder("Retained changes:\n");
        for (ChangeRecord record : retained) {
            payload.append("- ")
                    .append(record.getAction() != null ? record.getAction().getLabel() : "Unknown")
                    .append(' ')
                    .append(record.getName())
                    .append(" (")
                    .append(record.getType())
                    .append("): ")
                    .append(record.getDescription() != null ? record.getDescription() : "")
                    .append('\n');
        }
        return payload.toString();
    }

    public boolean hasIntentContext() {
        return (prTitle != null && !prTitle.isBlank())
                || (prDescription != null && !prDescription.isBlank());
    }

    public String toUserMessage() {
        StringBuilder message = new StringBuilder("Review this Azure deployment for safety.");
        if (hasIntentContext()) {
            message.append("\n\n<pull_request_intent>\n")
                    .append("Title: ").append(orNotProvided(prTitle)).append('\n')
                    .append("Description: ").append(orNotProvided(prDescription)).append('\n')
                    .append("</pull_request_intent>");
        }
        String tag = reclassification ? "retained_changes" : "whatif_output";
        message.append("\n\n<").append(tag).append(">\n")
                .append(primaryPayload)
                .append("\n</").append(tag).append('>');
        if (diffContent != null && !diffContent.isBlank()) {
            message.append("\n\n<code_diff>\n").append(diffContent).append("\n</code_diff>");
        }
        if (sourceContent != null && !sourceContent.isBlank()) {
            message.append("\n\n<template_source>\n").append(sourceContent).append("\n</template_source>");
        }
        return message.toString();
    }

    private static String orNotProvided(String value) {
        return value != null && !value.isBlank() ? value : "Not provided";
    }
}
