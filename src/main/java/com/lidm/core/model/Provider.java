package com.lidm.core.model;

import java.util.Locale;

/**
 * Rate-limit domain of a backend. Each provider has its own token bucket,
 * shared by every backend that talks to it.
 */
public enum Provider {
    LOCAL(100.0, 200),
    OPENAI(60.0, 100),
    ANTHROPIC(40.0, 60),
    PERPLEXITY(20.0, 40),
    OPENCLAW(30.0, 50);

    private final double defaultRate;
    private final int defaultBurst;

    Provider(double defaultRate, int defaultBurst) {
        this.defaultRate = defaultRate;
        this.defaultBurst = defaultBurst;
    }

    /** Tokens added per second when no override is configured. */
    public double defaultRate() {
        return defaultRate;
    }

    public int defaultBurst() {
        return defaultBurst;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Provider parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOCAL;
        }
        try {
            return Provider.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown provider: '" + raw + "'", e);
        }
    }
}
