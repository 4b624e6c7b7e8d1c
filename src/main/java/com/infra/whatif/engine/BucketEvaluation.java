package com.infra.whatif.engine;

import com.infra.whatif.model.RiskAssessment;
import com.infra.whatif.model.RiskBucket;

import java.util.List;

/**
 * @param safe                 true iff no bucket failed
 * @param failedBuckets        failing buckets in drift, intent, operations order
 * @param normalizedAssessment assessment with every risk level normalized to low/medium/high
 */
public record BucketEvaluation(boolean safe, List<RiskBucket> failedBuckets, RiskAssessment normalizedAssessment) {
}
