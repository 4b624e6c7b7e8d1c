package com.infra.whatif.oracle;

/**
 * The oracle answered, but no well-formed structured block could be extracted.
 */
public class OracleResponseException extends OracleException {

    private static final int PREVIEW_CHARS = 500;

    private final String responsePreview;

    public OracleResponseException(String message, String rawResponse) {
        super(message);
        this.responsePreview = preview(rawResponse);
    }

    /** First 500 characters of the raw response, enough to diagnose without dumping everything. */
    public String getResponsePreview() {
        return responsePreview;
    }

    private static String preview(String raw) {
        if (raw == null) return "";
        return raw.length() > PREVIEW_CHARS ? raw.substring(0, PREVIEW_CHARS) + "..." : raw;
    }
}
