package com.lidm.core.scheduler;

import com.lidm.core.model.Tier;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps required capabilities to the tier that should serve them. When several
 * capabilities are required, the highest ranked tier wins. Unknown capabilities
 * and empty requirements resolve to STANDARD.
 */
public class CapabilityTierResolver {

    public static final Map<String, Tier> DEFAULT_TABLE = defaultTable();

    private final Map<String, Tier> table;

    public CapabilityTierResolver() {
        this(Map.of());
    }

    /**
     * @param overrides entries that replace or extend the default table
     */
    public CapabilityTierResolver(Map<String, Tier> overrides) {
        var merged = new LinkedHashMap<>(DEFAULT_TABLE);
        overrides.forEach((capability, tier) -> merged.put(capability.toLowerCase(Locale.ROOT), tier));
        this.table = Map.copyOf(merged);
    }

    public Tier resolve(Collection<String> capabilities) {
        Tier best = null;
        if (capabilities != null) {
            for (String capability : capabilities) {
                Tier tier = tierFor(capability);
                if (best == null || tier.outranks(best)) {
                    best = tier;
                }
            }
        }
        return best == null ? Tier.STANDARD : best;
    }

    public Tier tierFor(String capability) {
        if (capability == null) {
            return Tier.STANDARD;
        }
        return table.getOrDefault(capability.trim().toLowerCase(Locale.ROOT), Tier.STANDARD);
    }

    public Map<String, Tier> table() {
        return table;
    }

    private static Map<String, Tier> defaultTable() {
        var table = new LinkedHashMap<String, Tier>();
        table.put("coding", Tier.HEAVY);
        table.put("reasoning", Tier.HEAVY);
        table.put("analysis", Tier.HEAVY);
        table.put("verification", Tier.ULTRA);
        table.put("deep_research", Tier.ULTRA);
        for (String capability : new String[]{"finance", "multilingual", "math", "fast_response",
                "routing", "classification", "extraction"}) {
            table.put(capability, Tier.STANDARD);
        }
        return Map.copyOf(table);
    }
}
