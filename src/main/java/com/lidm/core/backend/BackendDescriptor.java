package com.lidm.core.backend;

import com.lidm.core.model.Provider;
import com.lidm.core.model.Tier;

import java.util.List;
import java.util.Objects;

/**
 * Static description of a registered backend plus its last known liveness.
 */
public record BackendDescriptor(
    Tier tier,
    String name,
    String endpoint,
    Provider provider,
    String model,
    List<String> capabilities,
    boolean alive
) {

    public BackendDescriptor {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(name, "name");
        provider = provider == null ? Provider.LOCAL : provider;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public BackendDescriptor withAlive(boolean isAlive) {
        return new BackendDescriptor(tier, name, endpoint, provider, model, capabilities, isAlive);
    }
}
