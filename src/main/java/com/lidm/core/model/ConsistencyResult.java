package com.lidm.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Agreement among repeated samples of the same prompt.
 *
 * @param responses             raw sampled responses
 * @param majorityAnswer        first original response whose normalized form won the vote
 * @param agreementCount        number of responses agreeing with the majority
 * @param pHat                  agreementCount / responses.size(), 0 when there are no responses
 * @param confident             pHat at or above the confidence threshold
 * @param needsToolVerification pHat below the threshold
 */
public record ConsistencyResult(
    List<String> responses,
    String majorityAnswer,
    int agreementCount,
    double pHat,
    boolean confident,
    boolean needsToolVerification
) implements Serializable {

    public ConsistencyResult {
        responses = responses == null ? List.of() : List.copyOf(responses);
        majorityAnswer = majorityAnswer == null ? "" : majorityAnswer;
    }

    /** Result for a sampling run that produced nothing. */
    public static ConsistencyResult empty() {
        return new ConsistencyResult(List.of(), "", 0, 0.0, false, true);
    }

    public boolean isEmpty() {
        return responses.isEmpty();
    }
}
