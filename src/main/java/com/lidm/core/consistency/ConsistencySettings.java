package com.lidm.core.consistency;

/**
 * Self-consistency sampling parameters.
 *
 * @param threshold    p-hat at or above which an answer counts as confident
 * @param samples      samples drawn when verifying a subtask result
 * @param finalSamples samples drawn when verifying the final answer
 * @param temperature  sampling temperature; must be above 0 for samples to differ
 * @param maxTokens    completion cap per sample
 */
public record ConsistencySettings(double threshold, int samples, int finalSamples, double temperature, int maxTokens) {

    public ConsistencySettings {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1], got " + threshold);
        }
        if (samples < 1 || finalSamples < 1) {
            throw new IllegalArgumentException("sample counts must be >= 1, got " + samples + "/" + finalSamples);
        }
        if (temperature < 0.0) {
            throw new IllegalArgumentException("temperature must be >= 0, got " + temperature);
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1, got " + maxTokens);
        }
    }

    public static ConsistencySettings defaults() {
        return new ConsistencySettings(ConsistencyScorer.DEFAULT_THRESHOLD, 5, 3, 0.7, 1024);
    }
}
