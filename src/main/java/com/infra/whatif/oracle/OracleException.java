package com.infra.whatif.oracle;

/**
 * Failure to obtain a usable answer from the classification oracle.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
