package com.lidm.core.backend;

import com.lidm.core.model.Tier;

/**
 * A registered backend: its descriptor and the client used to call it.
 */
public record BackendHandle(BackendDescriptor descriptor, InferenceBackend backend) {

    public Tier tier() {
        return descriptor.tier();
    }

    public String name() {
        return descriptor.name();
    }

    public boolean alive() {
        return descriptor.alive();
    }
}
