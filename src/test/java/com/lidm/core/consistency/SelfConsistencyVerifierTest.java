package com.lidm.core.consistency;

import com.lidm.core.backend.DispatcherFixture;
import com.lidm.core.backend.ScriptedBackend;
import com.lidm.core.model.ConsistencyResult;
import com.lidm.core.model.DispatchOutcome;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.Tier;
import com.lidm.core.model.TraceEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelfConsistencyVerifierTest {

    private DispatcherFixture fixture;
    private SelfConsistencyVerifier verifier;
    private ExecutionTrace trace;

    @BeforeEach
    void setUp() {
        fixture = new DispatcherFixture();
        verifier = new SelfConsistencyVerifier(fixture.dispatcher(),
                new ConsistencySettings(0.6, 5, 3, 0.7, 512), fixture.metrics);
        trace = new ExecutionTrace();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("agreeing samples produce a confident result")
    void confidentWhenSamplesAgree() {
        var backend = fixture.register(Tier.STANDARD, ScriptedBackend.sequence("std", "4", "4", "5", "4", "4"));

        ConsistencyResult result = verifier.verify("2+2?", Tier.STANDARD, "verify", "st_1", trace);

        assertEquals("4", result.majorityAnswer());
        assertEquals(4, result.agreementCount());
        assertEquals(0.8, result.pHat(), 1e-9);
        assertTrue(result.confident());
        assertEquals(1, backend.batchCalls());
        assertEquals(5, backend.calls());
    }

    @Test
    @DisplayName("samples use the configured temperature and token cap")
    void usesConfiguredOptions() {
        var backend = fixture.register(Tier.STANDARD, ScriptedBackend.answering("std", "ok"));

        verifier.verify("q", Tier.STANDARD, "verify", null, trace);

        backend.options().forEach(options -> {
            assertEquals(0.7, options.temperature());
            assertEquals(512, options.maxTokens());
        });
    }

    @Test
    @DisplayName("explicit sample count and temperature override the settings")
    void explicitOverrides() {
        var backend = fixture.register(Tier.HEAVY, ScriptedBackend.answering("heavy", "ok"));

        verifier.verify("q", Tier.HEAVY, 3, 0.9, "verify", null, trace);

        assertEquals(3, backend.calls());
        assertEquals(0.9, backend.options().get(0).temperature());
    }

    @Test
    @DisplayName("disagreeing samples are not confident and ask for tool verification")
    void disagreementIsNotConfident() {
        fixture.register(Tier.STANDARD, ScriptedBackend.sequence("std", "a", "b", "c", "a", "d"));

        ConsistencyResult result = verifier.verify("q", Tier.STANDARD, "verify", null, trace);

        assertEquals(0.4, result.pHat(), 1e-9);
        assertFalse(result.confident());
        assertTrue(result.needsToolVerification());
    }

    @Test
    @DisplayName("a failed batch yields an empty, non-confident result")
    void failedBatchIsEmpty() {
        fixture.register(Tier.STANDARD, ScriptedBackend.failing("std", "model crashed"));

        ConsistencyResult result = verifier.verify("q", Tier.STANDARD, "verify", "st_2", trace);

        assertTrue(result.isEmpty());
        assertFalse(result.confident());
        assertEquals(1, trace.count(DispatchOutcome.FAILURE));
    }

    @Test
    @DisplayName("no backend at all yields an empty result instead of an error")
    void noBackendIsEmpty() {
        ConsistencyResult result = verifier.verify("q", Tier.LIGHT, "verify", null, trace);

        assertTrue(result.isEmpty());
        assertEquals(1, trace.count(DispatchOutcome.UNAVAILABLE));
    }

    @Test
    @DisplayName("the batch call is traced against the verified subtask")
    void tracesBatchCall() {
        fixture.register(Tier.STANDARD, ScriptedBackend.answering("std", "x"));

        verifier.verify("q", Tier.STANDARD, "verify", "st_3", trace);

        assertEquals(1, trace.size());
        TraceEntry entry = trace.entries().get(0);
        assertEquals("verify", entry.phase());
        assertEquals("st_3", entry.subtaskId());
        assertEquals(DispatchOutcome.SUCCESS, entry.outcome());
    }

    @Test
    @DisplayName("records agreement metrics")
    void recordsMetrics() {
        fixture.register(Tier.STANDARD, ScriptedBackend.answering("std", "x"));

        verifier.verify("q", Tier.STANDARD, "verify", null, trace);

        assertEquals(1L, fixture.meterRegistry.get("lidm.consistency.p_hat").summary().count());
        assertEquals(1.0, fixture.meterRegistry.get("lidm.consistency.verifications")
                .tag("confident", "true").counter().count());
    }
}
