package com.lidm.core.backend;

import com.lidm.core.model.Tier;

import java.util.Objects;

/**
 * What to send and where to start looking for a backend.
 *
 * @param tier      preferred tier; the fallback chain starts here
 * @param prompt    full prompt text
 * @param options   sampling parameters
 * @param phase     pipeline phase recorded in the trace
 * @param subtaskId subtask served, null for query-level calls
 */
public record DispatchRequest(Tier tier, String prompt, GenerationOptions options, String phase, String subtaskId) {

    public DispatchRequest {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(prompt, "prompt");
        options = options == null ? GenerationOptions.defaults() : options;
        phase = phase == null ? "execute" : phase;
    }

    public static DispatchRequest of(Tier tier, String prompt, GenerationOptions options, String phase) {
        return new DispatchRequest(tier, prompt, options, phase, null);
    }
}
