package com.lidm.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Result of classifying a query: what kind of task it is, which capabilities
 * it needs and how hard it is. Missing fields take safe defaults so a partial
 * model answer still yields a usable classification.
 *
 * @param taskType     free-form category (defaults to "general")
 * @param capabilities capability names (defaults to ["fast_response"])
 * @param complexity   difficulty in [0, 1] (defaults to 0.3, clamped)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Classification(
    @JsonProperty("task_type") @JsonAlias("taskType") String taskType,
    @JsonProperty("capabilities") List<String> capabilities,
    @JsonProperty("complexity") Double complexity
) implements Serializable {

    public static final String DEFAULT_TASK_TYPE = "general";
    public static final List<String> DEFAULT_CAPABILITIES = List.of("fast_response");
    public static final double DEFAULT_COMPLEXITY = 0.3;

    public Classification {
        taskType = taskType == null || taskType.isBlank() ? DEFAULT_TASK_TYPE : taskType.trim();
        capabilities = capabilities == null
                ? DEFAULT_CAPABILITIES
                : capabilities.stream()
                        .filter(c -> c != null && !c.isBlank())
                        .map(c -> c.trim().toLowerCase(Locale.ROOT))
                        .distinct()
                        .toList();
        if (capabilities.isEmpty()) {
            capabilities = DEFAULT_CAPABILITIES;
        }
        complexity = complexity == null || complexity.isNaN()
                ? DEFAULT_COMPLEXITY
                : Math.max(0.0, Math.min(1.0, complexity));
    }

    public static Classification defaults() {
        return new Classification(null, null, null);
    }
}
