package com.lidm.core.scheduler;

import com.lidm.core.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityTierResolverTest {

    private final CapabilityTierResolver resolver = new CapabilityTierResolver();

    @Test
    void defaultTable() {
        assertEquals(Tier.HEAVY, resolver.tierFor("coding"));
        assertEquals(Tier.HEAVY, resolver.tierFor("reasoning"));
        assertEquals(Tier.ULTRA, resolver.tierFor("verification"));
        assertEquals(Tier.STANDARD, resolver.tierFor("math"));
        assertEquals(Tier.STANDARD, resolver.tierFor("fast_response"));
    }

    @Test
    @DisplayName("the highest ranked tier among the capabilities wins")
    void highestTierWins() {
        assertEquals(Tier.HEAVY, resolver.resolve(List.of("math", "coding")));
        assertEquals(Tier.ULTRA, resolver.resolve(List.of("coding", "deep_research", "math")));
    }

    @Test
    @DisplayName("unknown and missing capabilities resolve to STANDARD")
    void unknownDefaultsToStandard() {
        assertEquals(Tier.STANDARD, resolver.tierFor("juggling"));
        assertEquals(Tier.STANDARD, resolver.tierFor(null));
        assertEquals(Tier.STANDARD, resolver.resolve(List.of()));
        assertEquals(Tier.STANDARD, resolver.resolve(null));
    }

    @Test
    void lookupIgnoresCaseAndWhitespace() {
        assertEquals(Tier.HEAVY, resolver.tierFor("  Coding "));
    }

    @Test
    @DisplayName("overrides replace and extend the default table")
    void overrides() {
        var custom = new CapabilityTierResolver(Map.of("Math", Tier.HEAVY, "translation", Tier.LIGHT));

        assertEquals(Tier.HEAVY, custom.tierFor("math"));
        assertEquals(Tier.LIGHT, custom.tierFor("translation"));
        assertEquals(Tier.HEAVY, custom.tierFor("coding"));
        assertEquals(Tier.LIGHT, custom.resolve(List.of("translation")));
    }
}
