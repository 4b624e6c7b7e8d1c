package com.infra.whatif.oracle;

/**
 * External text-classification backend. Implementations return the raw response text,
 * which may wrap the structured payload in prose; {@link OracleResponseParser} extracts it.
 */
public interface ClassificationOracle {

    /**
     * Short provider name used in logs and metrics.
     */
    String getProviderName();

    /**
     * Classify the changes described by the request.
     *
     * @throws OracleTimeoutException if the call exceeded the configured timeout
     * @throws OracleException        on any other transport or API failure
     */
    String classify(OracleRequest request);
}
