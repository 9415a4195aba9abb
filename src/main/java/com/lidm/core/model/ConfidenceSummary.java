package com.lidm.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * How much the final answer can be trusted.
 *
 * @param score                 p-hat of the final verification, null when no sampling was done
 * @param confident             whether the score reached the threshold
 * @param needsToolVerification whether an external check is recommended
 * @param method                {@code direct}, {@code unverified} or {@code self_consistency}
 * @param subtaskScores         p-hat per verified subtask id
 */
public record ConfidenceSummary(
    Double score,
    boolean confident,
    boolean needsToolVerification,
    String method,
    Map<String, Double> subtaskScores
) implements Serializable {

    public static final String METHOD_DIRECT = "direct";
    public static final String METHOD_UNVERIFIED = "unverified";
    public static final String METHOD_SELF_CONSISTENCY = "self_consistency";

    public ConfidenceSummary {
        subtaskScores = subtaskScores == null ? Map.of() : Map.copyOf(subtaskScores);
    }

    public static ConfidenceSummary unverified(String method, Map<String, Double> subtaskScores) {
        return new ConfidenceSummary(null, false, false, method, subtaskScores);
    }

    public static ConfidenceSummary fromConsistency(ConsistencyResult result, Map<String, Double> subtaskScores) {
        return new ConfidenceSummary(result.pHat(), result.confident(), result.needsToolVerification(),
                METHOD_SELF_CONSISTENCY, subtaskScores);
    }
}
