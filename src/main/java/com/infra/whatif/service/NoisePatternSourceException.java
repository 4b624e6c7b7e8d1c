package com.infra.whatif.service;

/**
 * A noise pattern file was named but could not be read. Not recovered internally;
 * the caller decides whether it aborts the evaluation.
 */
public class NoisePatternSourceException extends RuntimeException {

    private final String source;

    public NoisePatternSourceException(String source, Throwable cause) {
        super("Cannot read noise pattern file: " + source, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
