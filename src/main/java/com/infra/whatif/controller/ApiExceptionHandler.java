package com.infra.whatif.controller;

import com.infra.whatif.oracle.OracleException;
import com.infra.whatif.oracle.OracleResponseException;
import com.infra.whatif.oracle.OracleTimeoutException;
import com.infra.whatif.service.NoisePatternSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps evaluation failures to HTTP responses. Every failure here means no verdict was
 * produced; callers must treat it as "not deployable".
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(OracleTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleOracleTimeout(OracleTimeoutException ex) {
        return error(HttpStatus.GATEWAY_TIMEOUT, "ORACLE_TIMEOUT", ex.getMessage());
    }

    @ExceptionHandler(OracleResponseException.class)
    public ResponseEntity<Map<String, Object>> handleOracleResponse(OracleResponseException ex) {
        ResponseEntity<Map<String, Object>> response =
                error(HttpStatus.BAD_GATEWAY, "ORACLE_RESPONSE_INVALID", ex.getMessage());
        response.getBody().put("responsePreview", ex.getResponsePreview());
        return response;
    }

    @ExceptionHandler(OracleException.class)
    public ResponseEntity<Map<String, Object>> handleOracle(OracleException ex) {
        return error(HttpStatus.BAD_GATEWAY, "ORACLE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(NoisePatternSourceException.class)
    public ResponseEntity<Map<String, Object>> handleNoisePatternSource(NoisePatternSourceException ex) {
        ResponseEntity<Map<String, Object>> response =
                error(HttpStatus.UNPROCESSABLE_ENTITY, "NOISE_PATTERN_SOURCE_UNREADABLE", ex.getMessage());
        response.getBody().put("field", "noisePatternFile");
        return response;
    }

    @ExceptionHandler(InvalidRequestFieldException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidField(InvalidRequestFieldException ex) {
        ResponseEntity<Map<String, Object>> response =
                error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
        response.getBody().put("field", ex.getField());
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request body");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        log.warn("Evaluation request failed with {}: {}", code, message);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
