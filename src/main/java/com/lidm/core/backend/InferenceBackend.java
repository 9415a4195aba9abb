package com.lidm.core.backend;

/**
 * A single inference endpoint. Implementations may block and may throw any
 * runtime exception on failure; retries, timeouts and circuit breaking are
 * applied around them by {@link GuardedDispatcher}.
 */
public interface InferenceBackend {

    String generate(String prompt, GenerationOptions options);

    /** Draws {@code numSamples} independent samples of {@code prompt}. */
    BatchGeneration generateBatch(String prompt, int numSamples, GenerationOptions options);

    /** Cheap liveness probe; must not throw. */
    boolean ping();
}
