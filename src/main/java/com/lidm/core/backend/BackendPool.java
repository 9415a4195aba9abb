package com.lidm.core.backend;

import com.lidm.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of backends keyed by tier, at most one per tier, in registration order.
 * <p>
 * Resolution falls back from the requested tier to STANDARD, then to the first
 * live backend registered. Only live backends are ever returned. Written at
 * startup and on health refresh, read on every dispatch.
 */
public class BackendPool {

    private static final Logger log = LoggerFactory.getLogger(BackendPool.class);

    private final CopyOnWriteArrayList<BackendHandle> handles = new CopyOnWriteArrayList<>();

    /** Registers a backend, replacing any backend already registered for its tier. */
    public synchronized void register(BackendDescriptor descriptor, InferenceBackend backend) {
        var handle = new BackendHandle(descriptor, backend);
        for (int i = 0; i < handles.size(); i++) {
            if (handles.get(i).tier() == descriptor.tier()) {
                log.warn("Replacing backend '{}' for tier {} with '{}'",
                        handles.get(i).name(), descriptor.tier(), descriptor.name());
                handles.set(i, handle);
                return;
            }
        }
        handles.add(handle);
        log.info("Registered backend '{}' for tier {} at {} (alive={})",
                descriptor.name(), descriptor.tier(), descriptor.endpoint(), descriptor.alive());
    }

    /**
     * Live backend for {@code requested}, else the STANDARD backend, else the first
     * live backend in registration order.
     */
    public Optional<BackendHandle> resolve(Tier requested) {
        Optional<BackendHandle> exact = liveHandle(requested);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<BackendHandle> standard = liveHandle(Tier.STANDARD);
        if (standard.isPresent()) {
            log.debug("Tier {} unavailable, falling back to STANDARD", requested);
            return standard;
        }
        Optional<BackendHandle> any = handles.stream().filter(BackendHandle::alive).findFirst();
        any.ifPresent(h -> log.debug("Tier {} and STANDARD unavailable, falling back to {}", requested, h.tier()));
        return any;
    }

    public BackendHandle getBackend(Tier requested) {
        return resolve(requested).orElseThrow(() -> new NoBackendAvailableException(requested));
    }

    /**
     * Every distinct live backend in the order a dispatcher should try them:
     * the requested tier, STANDARD, then the rest by descending rank.
     */
    public List<BackendHandle> fallbackChain(Tier requested) {
        var chain = new LinkedHashSet<BackendHandle>();
        liveHandle(requested).ifPresent(chain::add);
        liveHandle(Tier.STANDARD).ifPresent(chain::add);
        handles.stream()
                .filter(BackendHandle::alive)
                .sorted(Comparator.comparingInt((BackendHandle h) -> h.tier().rank()).reversed())
                .forEach(chain::add);
        return new ArrayList<>(chain);
    }

    /** Updates liveness of the backend registered for {@code tier}, if any. */
    public synchronized void markAlive(Tier tier, boolean alive) {
        for (int i = 0; i < handles.size(); i++) {
            BackendHandle handle = handles.get(i);
            if (handle.tier() == tier && handle.alive() != alive) {
                handles.set(i, new BackendHandle(handle.descriptor().withAlive(alive), handle.backend()));
                if (alive) {
                    log.info("Backend '{}' ({}) is alive again", handle.name(), tier);
                } else {
                    log.warn("Backend '{}' ({}) marked down", handle.name(), tier);
                }
            }
        }
    }

    public Optional<BackendHandle> registered(Tier tier) {
        return handles.stream().filter(h -> h.tier() == tier).findFirst();
    }

    public List<BackendHandle> handles() {
        return List.copyOf(handles);
    }

    public List<BackendDescriptor> descriptors() {
        return handles.stream().map(BackendHandle::descriptor).toList();
    }

    public boolean hasLiveBackend() {
        return handles.stream().anyMatch(BackendHandle::alive);
    }

    public int size() {
        return handles.size();
    }

    private Optional<BackendHandle> liveHandle(Tier tier) {
        return handles.stream().filter(h -> h.tier() == tier && h.alive()).findFirst();
    }
}
