package com.lidm.core.backend;

/**
 * Sampling parameters for one generation call.
 *
 * @param maxTokens   completion length cap
 * @param temperature sampling temperature, 0 for greedy decoding
 */
public record GenerationOptions(int maxTokens, double temperature) {

    public GenerationOptions {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1, got " + maxTokens);
        }
        if (temperature < 0.0 || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("temperature must be >= 0, got " + temperature);
        }
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(1024, 0.7);
    }

    public GenerationOptions withTemperature(double newTemperature) {
        return new GenerationOptions(maxTokens, newTemperature);
    }

    public GenerationOptions withMaxTokens(int newMaxTokens) {
        return new GenerationOptions(newMaxTokens, temperature);
    }
}
