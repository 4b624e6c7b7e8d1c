package com.infra.whatif.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects non-fatal conditions raised while evaluating one deployment. Every warning is
 * also logged, so the condition stays visible even when the caller ignores the list.
 * One instance per evaluation; not shared between threads.
 */
public class EvaluationDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(EvaluationDiagnostics.class);

    private final List<String> warnings = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
        log.warn(message);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
