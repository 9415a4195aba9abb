package com.lidm.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Capability class of an inference backend. Higher rank means a more capable
 * (and more expensive) model.
 */
public enum Tier {
    LIGHT(1),
    STANDARD(2),
    HEAVY(3),
    ULTRA(4);

    private final int rank;

    Tier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** Lower-case name used for breaker names, metric tags and configuration keys. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean outranks(Tier other) {
        return rank > other.rank;
    }

    /**
     * Parses a tier name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known tier
     */
    public static Tier parse(String raw) {
        return tryParse(raw).orElseThrow(() ->
                new IllegalArgumentException("Unknown tier: '" + raw + "'"));
    }

    public static Optional<Tier> tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Tier.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
