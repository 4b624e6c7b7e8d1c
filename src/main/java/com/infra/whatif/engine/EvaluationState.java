package com.infra.whatif.engine;

/**
 * States of the deployment evaluation pipeline, in the order they are entered.
 * RECLASSIFIED is skipped when nothing was excluded.
 */
public enum EvaluationState {
    CLASSIFIED,
    NOISE_FILTERED,
    SPLIT,
    RECLASSIFIED,
    EVALUATED,
    VERDICT
}
