package com.lidm.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of a model-proposed decomposition, before validation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubTaskPlan(
    @JsonProperty("id") String id,
    @JsonProperty("instruction") @JsonAlias({"task", "description"}) String instruction,
    @JsonProperty("capabilities") @JsonAlias("required_capabilities") List<String> capabilities,
    @JsonProperty("depends_on") @JsonAlias({"dependsOn", "dependencies"}) List<String> dependsOn
) {}
