package com.lidm.core.consistency;

import com.fasterxml.jackson.databind.JsonNode;
import com.lidm.core.llm.StructuredOutputParser;
import com.lidm.core.model.ConsistencyResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Pure scoring functions for self-consistency: normalization, majority vote
 * and p-hat. Stateless and safe to call from any thread.
 */
public final class ConsistencyScorer {

    public static final double DEFAULT_THRESHOLD = 0.6;

    /** JSON fields that hold the actual answer, checked in this order. */
    static final List<String> ANSWER_FIELDS = List.of("content", "answer", "result", "output");

    private static final StructuredOutputParser PARSER = new StructuredOutputParser();

    private ConsistencyScorer() {}

    /**
     * Reduces a response to the form used for voting. A JSON object yields its
     * first answer field; other JSON yields canonical compact text; anything else
     * is trimmed and lower-cased. Fenced blocks are unwrapped first; JSON embedded
     * in prose does not count.
     */
    public static String normalize(String response) {
        if (response == null) {
            return "";
        }
        Optional<JsonNode> tree = PARSER.parseWholeTree(response);
        if (tree.isPresent()) {
            JsonNode node = tree.get();
            if (node.isObject()) {
                for (String field : ANSWER_FIELDS) {
                    JsonNode value = node.get(field);
                    if (value != null && !value.isNull()) {
                        return value.isTextual()
                                ? value.asText().trim().toLowerCase(Locale.ROOT)
                                : PARSER.canonicalText(value).toLowerCase(Locale.ROOT);
                    }
                }
            }
            if (node.isTextual()) {
                return node.asText().trim().toLowerCase(Locale.ROOT);
            }
            return PARSER.canonicalText(node).toLowerCase(Locale.ROOT);
        }
        String text = StructuredOutputParser.fencedBlock(response).orElse(response);
        return text.trim().toLowerCase(Locale.ROOT);
    }

    public static ConsistencyResult compute(List<String> responses) {
        return compute(responses, DEFAULT_THRESHOLD);
    }

    /**
     * Majority vote over normalized responses. Ties go to the normalized form seen
     * first; the reported answer is the first original response with that form.
     */
    public static ConsistencyResult compute(List<String> responses, double threshold) {
        if (responses == null || responses.isEmpty()) {
            return ConsistencyResult.empty();
        }
        List<String> samples = responses.stream().map(r -> r == null ? "" : r).toList();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> firstOriginal = new LinkedHashMap<>();
        for (String response : samples) {
            String key = normalize(response);
            counts.merge(key, 1, Integer::sum);
            firstOriginal.putIfAbsent(key, response);
        }
        String majorityKey = null;
        int majorityCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > majorityCount) {
                majorityKey = entry.getKey();
                majorityCount = entry.getValue();
            }
        }
        double pHat = (double) majorityCount / samples.size();
        boolean confident = pHat >= threshold;
        return new ConsistencyResult(samples, firstOriginal.get(majorityKey), majorityCount,
                pHat, confident, shouldUseToolVerification(pHat, threshold));
    }

    public static boolean shouldUseToolVerification(double score) {
        return shouldUseToolVerification(score, DEFAULT_THRESHOLD);
    }

    public static boolean shouldUseToolVerification(double score, double threshold) {
        return score < threshold;
    }

    /**
     * Weighted vote: each response contributes its weight to its normalized form.
     * The score is the winning weight over the total weight.
     *
     * @throws IllegalArgumentException if the lists differ in size or a weight is negative
     */
    public static WeightedAnswer weightedAnswer(List<String> responses, List<Double> weights) {
        if (responses.size() != weights.size()) {
            throw new IllegalArgumentException("responses (" + responses.size()
                    + ") and weights (" + weights.size() + ") must have the same size");
        }
        if (responses.isEmpty()) {
            return new WeightedAnswer("", 0.0);
        }
        Map<String, Double> totals = new LinkedHashMap<>();
        Map<String, String> firstOriginal = new LinkedHashMap<>();
        double totalWeight = 0.0;
        for (int i = 0; i < responses.size(); i++) {
            double weight = weights.get(i);
            if (weight < 0.0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("weight must be non-negative, got " + weight);
            }
            String key = normalize(responses.get(i));
            totals.merge(key, weight, Double::sum);
            firstOriginal.putIfAbsent(key, responses.get(i));
            totalWeight += weight;
        }
        String bestKey = null;
        double bestWeight = -1.0;
        for (Map.Entry<String, Double> entry : totals.entrySet()) {
            if (entry.getValue() > bestWeight) {
                bestKey = entry.getKey();
                bestWeight = entry.getValue();
            }
        }
        double score = totalWeight > 0.0 ? bestWeight / totalWeight : 0.0;
        return new WeightedAnswer(firstOriginal.get(bestKey), score);
    }

    /**
     * @param answer first original response of the heaviest normalized form
     * @param score  share of the total weight behind it
     */
    public record WeightedAnswer(String answer, double score) {}
}
