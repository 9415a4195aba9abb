package com.lidm.core.engine;

import com.lidm.core.model.Tier;

import java.util.Objects;

/**
 * Tuning of the classify / decompose / aggregate / verify pipeline.
 *
 * @param complexityThreshold       complexity at or above which a query is decomposed
 * @param maxSubtasks               cap on subtasks taken from a decomposition
 * @param synthesize                merge multiple subtask results with a synthesis call
 * @param verifySubtasks            resample each completed subtask of a decomposed query before accepting it
 * @param verifyFinal               run a self-consistency pass on decomposed answers
 * @param verifyComplexityThreshold complexity at or above which the final pass runs
 * @param escalateOnLowConfidence   re-ask a heavier tier when the final pass is not confident
 * @param controlTier               tier used for classification, decomposition, synthesis and verification
 */
public record DelegationSettings(
    double complexityThreshold,
    int maxSubtasks,
    boolean synthesize,
    boolean verifySubtasks,
    boolean verifyFinal,
    double verifyComplexityThreshold,
    boolean escalateOnLowConfidence,
    Tier controlTier
) {

    public DelegationSettings {
        Objects.requireNonNull(controlTier, "controlTier");
        if (complexityThreshold < 0.0 || complexityThreshold > 1.0) {
            throw new IllegalArgumentException("complexityThreshold must be in [0, 1], got " + complexityThreshold);
        }
        if (verifyComplexityThreshold < 0.0 || verifyComplexityThreshold > 1.0) {
            throw new IllegalArgumentException("verifyComplexityThreshold must be in [0, 1], got "
                    + verifyComplexityThreshold);
        }
        if (maxSubtasks < 1) {
            throw new IllegalArgumentException("maxSubtasks must be >= 1, got " + maxSubtasks);
        }
    }

    public static DelegationSettings defaults() {
        return new DelegationSettings(0.5, 5, true, true, true, 0.8, true, Tier.STANDARD);
    }
}
