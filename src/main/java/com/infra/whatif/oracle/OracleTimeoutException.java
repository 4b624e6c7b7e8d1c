package com.infra.whatif.oracle;

public class OracleTimeoutException extends OracleException {

    public OracleTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
