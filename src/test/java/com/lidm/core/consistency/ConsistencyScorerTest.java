package com.lidm.core.consistency;

import com.lidm.core.model.ConsistencyResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyScorerTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        void trimsAndLowerCasesPlainText() {
            assertEquals("paris", ConsistencyScorer.normalize("  Paris \n"));
        }

        @Test
        void nullBecomesEmpty() {
            assertEquals("", ConsistencyScorer.normalize(null));
        }

        @Test
        @DisplayName("extracts the answer field of a JSON object")
        void extractsAnswerField() {
            assertEquals("paris", ConsistencyScorer.normalize("{\"answer\": \" Paris \", \"reasoning\": \"capital\"}"));
        }

        @Test
        @DisplayName("prefers content over answer")
        void prefersContentField() {
            assertEquals("a", ConsistencyScorer.normalize("{\"answer\": \"b\", \"content\": \"A\"}"));
        }

        @Test
        void nonTextualAnswerFieldIsRenderedAsJson() {
            assertEquals("42", ConsistencyScorer.normalize("{\"result\": 42}"));
        }

        @Test
        @DisplayName("unwraps a fenced JSON block")
        void unwrapsFencedJson() {
            String fenced = "Here you go:\n```json\n{\"answer\": \"Paris\"}\n```";
            assertEquals("paris", ConsistencyScorer.normalize(fenced));
        }

        @Test
        @DisplayName("objects with the same content but different key order normalize identically")
        void keyOrderDoesNotMatter() {
            assertEquals(ConsistencyScorer.normalize("{\"b\": 1, \"a\": 2}"),
                    ConsistencyScorer.normalize("{\"a\": 2, \"b\": 1}"));
        }

        @Test
        void proseIsLeftAsText() {
            assertEquals("the answer is 4", ConsistencyScorer.normalize("The answer is 4"));
        }

        @Test
        @DisplayName("brackets inside prose do not make it JSON")
        void citationMarkerStaysProse() {
            assertEquals("paris is the capital of france [1].",
                    ConsistencyScorer.normalize("Paris is the capital of France [1]."));
        }
    }

    @Nested
    @DisplayName("compute")
    class Compute {

        @Test
        @DisplayName("majority vote ignores case and surrounding whitespace")
        void majorityVote() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of("Paris", "paris", " PARIS ", "London"));

            assertEquals("Paris", result.majorityAnswer());
            assertEquals(3, result.agreementCount());
            assertEquals(0.75, result.pHat(), 1e-9);
            assertTrue(result.confident());
            assertFalse(result.needsToolVerification());
            assertEquals(4, result.responses().size());
        }

        @Test
        @DisplayName("ties go to the answer seen first")
        void tieGoesToFirstSeen() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of("blue", "green", "green", "blue"));

            assertEquals("blue", result.majorityAnswer());
            assertEquals(0.5, result.pHat(), 1e-9);
            assertFalse(result.confident());
            assertTrue(result.needsToolVerification());
        }

        @Test
        @DisplayName("confidence is inclusive at the threshold")
        void thresholdIsInclusive() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of("a", "a", "a", "b", "c"), 0.6);

            assertEquals(0.6, result.pHat(), 1e-9);
            assertTrue(result.confident());
            assertFalse(result.needsToolVerification());
        }

        @Test
        void customThresholdApplies() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of("a", "a", "a", "b"), 0.9);

            assertFalse(result.confident());
            assertTrue(result.needsToolVerification());
        }

        @Test
        void emptyInputGivesEmptyResult() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of());

            assertTrue(result.isEmpty());
            assertEquals(0.0, result.pHat());
            assertEquals("", result.majorityAnswer());
            assertFalse(result.confident());
            assertTrue(result.needsToolVerification());
        }

        @Test
        void nullInputGivesEmptyResult() {
            assertTrue(ConsistencyScorer.compute(null).isEmpty());
        }

        @Test
        @DisplayName("null samples count as empty answers")
        void nullSamplesCountAsEmpty() {
            ConsistencyResult result = ConsistencyScorer.compute(Arrays.asList("x", null, "x"));

            assertEquals("x", result.majorityAnswer());
            assertEquals(2, result.agreementCount());
            assertEquals(2.0 / 3.0, result.pHat(), 1e-9);
            assertEquals(List.of("x", "", "x"), result.responses());
        }

        @Test
        @DisplayName("JSON answers agree with equivalent prose answers")
        void jsonAndProseAgree() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of("{\"answer\": \"4\"}", "4", "5"));

            assertEquals(2, result.agreementCount());
            assertEquals("{\"answer\": \"4\"}", result.majorityAnswer());
        }

        @Test
        @DisplayName("different prose answers sharing a citation marker do not agree")
        void sharedCitationMarkerIsNotAgreement() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of(
                    "Paris is the capital of France [1].",
                    "Berlin is the capital of France [1].",
                    "London is the capital of France [1].",
                    "Madrid is the capital of France [1].",
                    "Rome is the capital of France [1]."));

            assertEquals(1, result.agreementCount());
            assertEquals(0.2, result.pHat(), 1e-9);
            assertFalse(result.confident());
            assertTrue(result.needsToolVerification());
        }

        @Test
        void singleSampleIsFullyConfident() {
            ConsistencyResult result = ConsistencyScorer.compute(List.of("only"));

            assertEquals(1.0, result.pHat());
            assertTrue(result.confident());
        }
    }

    @Nested
    @DisplayName("weightedAnswer")
    class Weighted {

        @Test
        @DisplayName("heaviest normalized form wins")
        void heaviestWins() {
            var weighted = ConsistencyScorer.weightedAnswer(List.of("A", "b", "B"), List.of(0.9, 0.3, 0.3));

            assertEquals("A", weighted.answer());
            assertEquals(0.6, weighted.score(), 1e-9);
        }

        @Test
        @DisplayName("many light votes beat one heavy vote")
        void lightVotesAccumulate() {
            var weighted = ConsistencyScorer.weightedAnswer(
                    List.of("x", "y", "y", "y"), List.of(1.0, 0.5, 0.5, 0.5));

            assertEquals("y", weighted.answer());
            assertEquals(0.6, weighted.score(), 1e-9);
        }

        @Test
        void emptyInputScoresZero() {
            var weighted = ConsistencyScorer.weightedAnswer(List.of(), List.of());

            assertEquals("", weighted.answer());
            assertEquals(0.0, weighted.score());
        }

        @Test
        void zeroWeightsScoreZero() {
            var weighted = ConsistencyScorer.weightedAnswer(List.of("a", "b"), List.of(0.0, 0.0));

            assertEquals("a", weighted.answer());
            assertEquals(0.0, weighted.score());
        }

        @Test
        void rejectsMismatchedSizes() {
            assertThrows(IllegalArgumentException.class,
                    () -> ConsistencyScorer.weightedAnswer(List.of("a", "b"), List.of(1.0)));
        }

        @Test
        void rejectsNegativeWeight() {
            assertThrows(IllegalArgumentException.class,
                    () -> ConsistencyScorer.weightedAnswer(List.of("a"), List.of(-0.1)));
        }
    }

    @Test
    @DisplayName("tool verification is suggested strictly below the threshold")
    void toolVerificationBoundary() {
        assertTrue(ConsistencyScorer.shouldUseToolVerification(0.59));
        assertFalse(ConsistencyScorer.shouldUseToolVerification(0.6));
        assertTrue(ConsistencyScorer.shouldUseToolVerification(0.79, 0.8));
    }
}
