package com.lidm.core.nodes;

import com.lidm.core.backend.DispatcherFixture;
import com.lidm.core.backend.ScriptedBackend;
import com.lidm.core.consistency.ConsistencySettings;
import com.lidm.core.consistency.SelfConsistencyVerifier;
import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.model.Classification;
import com.lidm.core.model.DecompositionStrategy;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.SubTask;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.model.Tier;
import com.lidm.core.model.TraceEntry;
import com.lidm.core.state.DelegationState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregateResultsNodeTest {

    private DispatcherFixture fixture;
    private SelfConsistencyVerifier verifier;

    @BeforeEach
    void setUp() {
        fixture = new DispatcherFixture();
        verifier = new SelfConsistencyVerifier(fixture.dispatcher(),
                new ConsistencySettings(0.6, 5, 3, 0.7, 512), fixture.metrics);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private AggregateResultsNode node(boolean synthesize, boolean verifySubtasks) {
        var settings = new DelegationSettings(0.5, 5, synthesize, verifySubtasks, true, 0.8, true, Tier.STANDARD);
        return new AggregateResultsNode(fixture.dispatcher(), verifier, settings);
    }

    private AggregateResultsNode node() {
        return node(true, false);
    }

    private static SubTask done(String id, String result, String... dependsOn) {
        return SubTask.pending(id, "instruction " + id, List.of("math"), List.of(dependsOn))
                .running("prompt " + id)
                .completed(result, Tier.STANDARD, 10L);
    }

    private static SubTask failed(String id, String error) {
        return SubTask.pending(id, "instruction " + id, List.of("math"), List.of())
                .running("prompt " + id)
                .failed(error);
    }

    private static DelegationState state(double complexity, DecompositionStrategy strategy, SubTask... subtasks) {
        var classification = new Classification("analysis", List.of("math", "reasoning"), complexity);
        var decomposition = new TaskDecomposition("the query", List.of(subtasks), strategy,
                "analysis", complexity, classification.capabilities());
        return new DelegationState(Map.of(
                "queryId", "Q-2",
                "query", "the query",
                "classification", classification,
                "decomposition", decomposition));
    }

    private static DelegationState decomposed(double complexity, SubTask... subtasks) {
        return state(complexity, DecompositionStrategy.DECOMPOSE, subtasks);
    }

    @Nested
    @DisplayName("answer assembly")
    class Assembly {

        @Test
        @DisplayName("a single completed subtask is the answer without any call")
        void singleResultIsAnswer() {
            var backend = fixture.register(Tier.STANDARD, ScriptedBackend.answering("std", "unused"));

            Map<String, Object> updates = node().apply(state(0.2, DecompositionStrategy.DIRECT, done("st_1", "Paris")));

            assertEquals("Paris", updates.get("answer"));
            assertEquals("prompt st_1", updates.get("verificationPrompt"));
            assertEquals(QueryStatus.DONE.name(), updates.get("status"));
            assertEquals(false, updates.get("verificationRequired"));
            assertEquals(0, backend.calls());
        }

        @Test
        @DisplayName("several results are merged by one synthesis call")
        void synthesizesSeveralResults() {
            var backend = fixture.register(Tier.STANDARD, ScriptedBackend.answering("std", "merged answer"));

            Map<String, Object> updates = node().apply(decomposed(0.6, done("st_1", "A"), done("st_2", "B")));

            assertEquals("merged answer", updates.get("answer"));
            assertEquals(1, backend.calls());
            String prompt = backend.prompts().get(0);
            assertTrue(prompt.contains("Original query: the query"));
            assertTrue(prompt.contains("[st_1] A\n\n[st_2] B"));
            assertEquals(prompt, updates.get("verificationPrompt"));
            @SuppressWarnings("unchecked")
            List<TraceEntry> trace = (List<TraceEntry>) updates.get("trace");
            assertEquals("aggregate", trace.get(0).phase());
        }

        @Test
        @DisplayName("results are combined in dependency order")
        void dependencyOrder() {
            Map<String, Object> updates = node(false, false).apply(
                    decomposed(0.6, done("st_2", "second", "st_1"), done("st_1", "first")));

            assertEquals("[st_1] first\n\n[st_2] second", updates.get("answer"));
        }

        @Test
        @DisplayName("a failed synthesis call keeps the concatenation")
        void synthesisFailureKeepsConcatenation() {
            fixture.register(Tier.STANDARD, ScriptedBackend.failing("std", "overloaded"));

            Map<String, Object> updates = node().apply(decomposed(0.6, done("st_1", "A"), done("st_2", "B")));

            assertEquals("[st_1] A\n\n[st_2] B", updates.get("answer"));
        }

        @Test
        @DisplayName("failed subtasks are left out of the answer")
        void skipsFailedSubtasks() {
            Map<String, Object> updates = node(false, false).apply(
                    decomposed(0.6, done("st_1", "A"), failed("st_2", "boom"), done("st_3", "C")));

            assertEquals("[st_1] A\n\n[st_3] C", updates.get("answer"));
        }

        @Test
        @DisplayName("no completed subtask fails the query")
        void allFailed() {
            Map<String, Object> updates = node().apply(
                    decomposed(0.6, failed("st_1", "boom"), failed("st_2", "bang")));

            assertEquals(QueryStatus.FAILED.name(), updates.get("status"));
            assertEquals("All subtasks failed: st_1 (boom), st_2 (bang)", updates.get("error"));
            assertFalse(updates.containsKey("answer"));
        }
    }

    @Nested
    @DisplayName("final verification decision")
    class VerificationDecision {

        @Test
        void complexDecomposedQueryIsVerified() {
            Map<String, Object> updates = node(false, false).apply(
                    decomposed(0.85, done("st_1", "A"), done("st_2", "B")));

            assertEquals(true, updates.get("verificationRequired"));
            assertEquals(QueryStatus.VERIFYING.name(), updates.get("status"));
        }

        @Test
        void moderateQueryIsNotVerified() {
            Map<String, Object> updates = node(false, false).apply(
                    decomposed(0.6, done("st_1", "A"), done("st_2", "B")));

            assertEquals(false, updates.get("verificationRequired"));
            assertEquals(QueryStatus.DONE.name(), updates.get("status"));
        }

        @Test
        @DisplayName("a partial failure triggers verification regardless of complexity")
        void partialFailureIsVerified() {
            Map<String, Object> updates = node(false, false).apply(
                    decomposed(0.6, done("st_1", "A"), failed("st_2", "boom")));

            assertEquals(true, updates.get("verificationRequired"));
        }

        @Test
        @DisplayName("direct answers are never verified")
        void directIsNotVerified() {
            Map<String, Object> updates = node().apply(state(0.95, DecompositionStrategy.DIRECT, done("st_1", "A")));

            assertEquals(false, updates.get("verificationRequired"));
        }
    }

    @Nested
    @DisplayName("subtask verification")
    class SubtaskVerification {

        @Test
        @DisplayName("a confident resample replaces the subtask result and records its score")
        void confidentResampleReplacesResult() {
            var backend = fixture.register(Tier.STANDARD, ScriptedBackend.answering("std", "refined"));

            Map<String, Object> updates = node(false, true).apply(decomposed(0.3, done("st_1", "draft")));

            assertEquals("refined", updates.get("answer"));
            assertEquals(Map.of("st_1", 1.0), updates.get("subtaskScores"));
            assertEquals(1, backend.batchCalls());
            var decomposition = (TaskDecomposition) updates.get("decomposition");
            assertEquals("refined", decomposition.subtask("st_1").orElseThrow().result());
        }

        @Test
        @DisplayName("an unconfident resample keeps the original result")
        void unconfidentResampleKeepsResult() {
            fixture.register(Tier.STANDARD, ScriptedBackend.sequence("std", "a", "b", "c", "d", "e"));

            Map<String, Object> updates = node(false, true).apply(decomposed(0.3, done("st_1", "draft")));

            assertEquals("draft", updates.get("answer"));
            assertEquals(Map.of("st_1", 0.2), updates.get("subtaskScores"));
        }

        @Test
        @DisplayName("a direct query is not resampled")
        void directQueryIsNotResampled() {
            var backend = fixture.register(Tier.STANDARD, ScriptedBackend.answering("std", "refined"));

            Map<String, Object> updates = node(false, true).apply(
                    state(0.3, DecompositionStrategy.DIRECT, done("st_1", "draft")));

            assertEquals("draft", updates.get("answer"));
            assertEquals(Map.of(), updates.get("subtaskScores"));
            assertEquals(0, backend.batchCalls());
        }
    }
}
