package com.lidm.core.backend;

import java.util.List;

/**
 * Several samples of the same prompt with the backend's own majority count.
 * Callers that need a trustworthy score re-score {@link #responses()} themselves.
 */
public record BatchGeneration(List<String> responses, String majorityAnswer, int majorityCount) {

    public BatchGeneration {
        responses = responses == null ? List.of() : List.copyOf(responses);
    }
}
