package org.calista.r3.reason;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.r3.reason.impl.LexicalComponentExtractor;
import org.calista.r3.reflect.ReflectionBaselines;
import org.calista.r3.state.EngineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReasoningEngineTest {

    private EngineState state;
    private ConceptGraph graph;
    private ReasoningEngine engine;

    @BeforeEach
    void setUp() {
        state = new EngineState();
        graph = ConceptGraph.withLogicalOperators();
        engine = new ReasoningEngine(new LexicalComponentExtractor(), graph, state, 10, 8, () -> 1_000L);
    }

    @Nested
    @DisplayName("base reasoning")
    class Base {

        @Test
        void reasonAbout_shouldReportUnknownEntityAndValidRelation() {
            // Act
            ReasoningResult r = engine.reasonAbout("John is a teacher", Map.of(), 3);

            // Assert
            assertThat(r.components.entities).containsExactly("John");
            assertThat(r.components.relations).extracting(x -> x.relation).containsExactly("is");
            assertThat(r.unknowns()).containsExactly("John");
            assertThat(r.base.directInferences).singleElement()
                    .satisfies(i -> assertThat(i.type).isEqualTo(Inference.RELATION_VALID));
            assertThat(r.contradictions()).isEmpty();
            assertThat(r.patterns()).isEmpty();
            assertThat(r.base.needsRefinement).isTrue();
        }

        @Test
        void reasonAbout_shouldAcceptQuestionOpeningWithRelationWord() {
            ReasoningResult r = engine.reasonAbout("Is AI conscious?", Map.of(), 1);

            assertThat(r.contradictions()).isEmpty();
            assertThat(r.unknowns()).isEmpty();
            assertThat(r.base.directInferences).singleElement()
                    .satisfies(i -> assertThat(i.type).isEqualTo(Inference.RELATION_VALID));
            assertThat(r.refinement).isNull();
            assertThat(r.certainty).isCloseTo(0.7, within(1e-9));
        }

        @Test
        void reasonAbout_shouldTreatCapitalizedQuantifierAsUnknownEntity() {
            ReasoningResult r = engine.reasonAbout("Every Greek is mortal", Map.of(), 1);

            assertThat(r.unknowns()).containsExactly("Every", "Greek");
            assertThat(r.patterns()).isEmpty();
            assertThat(r.certainty).isCloseTo(0.5, within(1e-9));
        }

        @Test
        void reasonAbout_shouldScoreRelationOutsideVocabularyAsContradiction() {
            // Arrange
            ComponentExtractor extractor = mock(ComponentExtractor.class);
            when(extractor.extract("x likes y")).thenReturn(new Components(List.of(),
                    List.of(new Relation("x", "likes", "y")), List.of(), List.of(), List.of(), List.of()));
            ReasoningEngine e = new ReasoningEngine(extractor, new ConceptGraph(), new EngineState(), 10, 8, () -> 0L);

            // Act
            ReasoningResult r = e.reasonAbout("x likes y", Map.of(), 1);

            // Assert
            assertThat(r.contradictions()).containsExactly("Invalid relation: x likes y");
            assertThat(r.refinement).isNull();
            assertThat(r.certainty).isCloseTo(0.5, within(1e-9));
            assertThat(r.emergence).isZero();
        }

        @Test
        void reasonAbout_shouldDetectImplicationPattern() {
            ReasoningResult r = engine.reasonAbout("If it rains then we stay", Map.of(), 1);

            assertThat(r.patterns()).singleElement().satisfies(p -> {
                assertThat(p.type).isEqualTo(PatternMatch.IMPLICATION);
                assertThat(p.certainty).isEqualTo(0.8);
            });
            assertThat(r.unknowns()).containsExactly("it", "we");
        }

        @Test
        void reasonAbout_shouldFlagComponentContradiction() {
            ReasoningResult r = engine.reasonAbout("rain and not rain", Map.of(), 1);

            assertThat(r.contradictions()).containsExactly("Logical contradiction detected in components");
        }

        @Test
        void reasonAbout_shouldDeduplicateRepeatedEntities() {
            ReasoningResult r = engine.reasonAbout("Zeno Zeno Zeno", Map.of(), 1);

            assertThat(r.unknowns()).containsExactly("Zeno");
            assertThat(r.certainty).isCloseTo(0.6, within(1e-9));
        }
    }

    @Nested
    @DisplayName("refinement")
    class Refine {

        @Test
        void reasonAbout_shouldHypothesizeUnknownsAndScoreEmergence() {
            ReasoningResult r = engine.reasonAbout("John is a teacher", Map.of(), 3);

            assertThat(r.refinement).isNotNull();
            assertThat(r.refinement.depth).isEqualTo(2);
            assertThat(r.refinement.chainLength()).isEqualTo(1);
            assertThat(r.novelInsights).singleElement().satisfies(x -> {
                assertThat(x.kind).isEqualTo(Refinement.Kind.HYPOTHESIS);
                assertThat(x.subject).isEqualTo("John");
            });
            assertThat(r.certainty).isCloseTo(0.65, within(1e-9));
            assertThat(r.emergence).isCloseTo(1.3, within(1e-9));
            assertThat(r.depthUsed).isEqualTo(3);
        }

        @Test
        void reasonAbout_shouldFollowImplicationsIntoNextPass() {
            ReasoningResult r = engine.reasonAbout("IMPLIES holds", Map.of(), 3);

            assertThat(r.base.knownEntities).containsExactly("IMPLIES");
            assertThat(r.refinement.refinements).singleElement()
                    .satisfies(x -> assertThat(x.content).isEqualTo("IMPLIES relates to operator_IMPLIES"));
            assertThat(r.refinement.discoveredUnknowns).containsExactly("operator_IMPLIES");
            assertThat(r.refinement.next.refinements).singleElement()
                    .satisfies(x -> assertThat(x.kind).isEqualTo(Refinement.Kind.HYPOTHESIS));
            assertThat(r.refinement.chainLength()).isEqualTo(2);
            assertThat(r.refinement.isBudgetExhausted()).isFalse();
            assertThat(r.certainty).isCloseTo(0.8, within(1e-9));
        }

        @Test
        void reasonAbout_shouldEndChainWithSentinelWhenBudgetRunsOut() {
            ReasoningResult r = engine.reasonAbout("IMPLIES holds", Map.of(), 2);

            assertThat(r.refinement.depth).isEqualTo(1);
            assertThat(r.refinement.next).isNotNull();
            assertThat(r.refinement.next.maxDepthReached).isTrue();
            assertThat(r.refinement.next.status).isEqualTo(RefinementPass.STATUS_MAX_DEPTH);
            assertThat(r.refinement.isBudgetExhausted()).isTrue();
            assertThat(r.refinementCount()).isEqualTo(1);
        }

        @Test
        void reasonAbout_shouldCapImplicationsPerPass() {
            ConceptGraph wide = new ConceptGraph();
            for (int i = 0; i < 20; i++) wide.relate("Hub", "spoke" + i);
            ReasoningEngine narrow = new ReasoningEngine(new LexicalComponentExtractor(), wide, new EngineState(), 10, 3, () -> 0L);

            ReasoningResult r = narrow.reasonAbout("Hub", Map.of(), 2);

            assertThat(r.refinement.refinements).hasSize(3);
        }
    }

    @Nested
    @DisplayName("cache")
    class Cache {

        @Test
        void reasonAbout_shouldReturnCachedResultForIdenticalCall() {
            ReasoningResult first = engine.reasonAbout("John is a teacher", Map.of("k", 1), 3);
            ReasoningResult second = engine.reasonAbout("John  is a teacher ", Map.of("k", 1), 3);

            assertThat(second).isSameAs(first);
            assertThat(second.query).isEqualTo("John is a teacher");
            ReasoningEngine.Stats s = engine.stats();
            assertThat(s.queriesProcessed).isEqualTo(1);
            assertThat(s.cacheHits).isEqualTo(1);
            assertThat(s.cacheHitRate).isEqualTo(0.5);
            assertThat(s.cacheSize).isEqualTo(1);
        }

        @Test
        void reasonAbout_shouldReportNormalizedQueryForWhitespaceVariants() {
            ReasoningResult messy = engine.reasonAbout("  John   is a\tteacher ", Map.of(), 3);
            ReasoningResult clean = new ReasoningEngine(new LexicalComponentExtractor(),
                    ConceptGraph.withLogicalOperators(), new EngineState(), 10, 8, () -> 1_000L)
                    .reasonAbout("John is a teacher", Map.of(), 3);

            assertThat(engine.reasonAbout("John is a teacher", Map.of(), 3)).isSameAs(messy);
            assertThat(messy.query).isEqualTo("John is a teacher");
            assertThat(messy.hash).isEqualTo(clean.hash);
        }

        @Test
        void reasonAbout_shouldMissCacheForDifferentDepthOrContext() {
            ReasoningResult a = engine.reasonAbout("John is a teacher", Map.of(), 3);

            assertThat(engine.reasonAbout("John is a teacher", Map.of(), 2)).isNotSameAs(a);
            assertThat(engine.reasonAbout("John is a teacher", Map.of("x", true), 3)).isNotSameAs(a);
            assertThat(engine.stats().cacheHits).isZero();
        }

        @Test
        void reasonAbout_shouldInvalidateCacheWhenGraphChanges() {
            ReasoningResult before = engine.reasonAbout("John is a teacher", Map.of(), 3);

            graph.addConcept("John");
            ReasoningResult after = engine.reasonAbout("John is a teacher", Map.of(), 3);

            assertThat(after).isNotSameAs(before);
            assertThat(after.unknowns()).isEmpty();
            assertThat(after.base.knownEntities).containsExactly("John");
            assertThat(after.hash).isNotEqualTo(before.hash);
        }

        @Test
        void reasonAbout_shouldCallExtractorOncePerDistinctCall() {
            // Arrange
            ComponentExtractor extractor = mock(ComponentExtractor.class);
            when(extractor.extract("q")).thenReturn(
                    new Components(List.of("X"), List.of(), List.of(), List.of(), List.of(), List.of()));
            ReasoningEngine e = new ReasoningEngine(extractor, new ConceptGraph(), new EngineState(), 10, 8, () -> 0L);

            // Act
            ReasoningResult r = e.reasonAbout("q", Map.of(), 1);
            e.reasonAbout("q", Map.of(), 1);

            // Assert
            assertThat(r.unknowns()).containsExactly("X");
            verify(extractor, times(1)).extract("q");
        }
    }

    @Test
    void reasonAbout_shouldProduceSameHashAcrossEnginesAndClocks() {
        ReasoningEngine other = new ReasoningEngine(new LexicalComponentExtractor(),
                ConceptGraph.withLogicalOperators(), new EngineState(10.0, new ReflectionBaselines(), 4), 10, 8, () -> 77L);

        ReasoningResult a = engine.reasonAbout("All birds can fly if AND holds then", Map.of("a", 1), 4);
        ReasoningResult b = other.reasonAbout("All birds can fly if AND holds then", Map.of("a", 1), 4);

        assertThat(a.hash).isEqualTo(b.hash);
        assertThat(a.timestampEpochMs).isNotEqualTo(b.timestampEpochMs);
    }

    @Test
    void reasonAbout_shouldClampRequestedDepth() {
        assertThat(engine.reasonAbout("x", Map.of(), 0).depthUsed).isEqualTo(1);
        assertThat(engine.reasonAbout("x", Map.of(), 99).depthUsed).isEqualTo(10);
    }

    @ParameterizedTest
    @CsvSource({
            "'What is consciousness?', 3",
            "'If all Humans are mortal then Socrates is dying', 10",
            "'We They You It She He I', 10",
            "'NOT AND OR IMPLIES IFF FORALL EXISTS EQUALS', 10",
            "'', 5"
    })
    void reasonAbout_shouldKeepScoresInRange(String query, int depth) {
        ReasoningResult r = engine.reasonAbout(query, Map.of(), depth);

        assertThat(r.certainty).isBetween(ReasoningEngine.MIN_CERTAINTY, 1.0);
        assertThat(r.emergence).isBetween(0.0, ReasoningEngine.EMERGENCE_CAP);
        assertThat(r.novelInsights.size()).isLessThanOrEqualTo(r.refinementCount());
    }

    @Test
    void reasoningResult_shouldSerializeWithoutDerivedGetters() {
        ReasoningResult r = engine.reasonAbout("John is a teacher", Map.of(), 3);

        JsonNode json = new ObjectMapper().valueToTree(r);

        assertThat(json.get("hash").asText()).isEqualTo(r.hash);
        assertThat(json.has("depthUsed")).isTrue();
        assertThat(json.get("refinement").has("budgetExhausted")).isFalse();
        assertThat(json.get("components").has("empty")).isFalse();
    }

    @Nested
    @DisplayName("scoring")
    class Scoring {

        @Test
        void certainty_shouldFollowPenaltiesAndBonusesWithClamp() {
            assertThat(ReasoningEngine.certainty(2, 1, 0, 0)).isCloseTo(0.3, within(1e-12));
            assertThat(ReasoningEngine.certainty(10, 0, 0, 0)).isEqualTo(0.1);
            assertThat(ReasoningEngine.certainty(0, 0, 10, 10)).isEqualTo(1.0);
            assertThat(ReasoningEngine.certainty(0, 0, 100, 0)).isCloseTo(1.0, within(1e-12));
        }

        @Test
        void emergence_shouldBeZeroWithoutInsightsAndCapped() {
            assertThat(ReasoningEngine.emergence(0, 5, 10)).isZero();
            assertThat(ReasoningEngine.emergence(1, 0, 1)).isCloseTo(1.0, within(1e-12));
            assertThat(ReasoningEngine.emergence(3, 2, 4)).isCloseTo(2.0 * 1.2 * 2.0, within(1e-12));
            assertThat(ReasoningEngine.emergence(1000, 10, 100)).isEqualTo(ReasoningEngine.EMERGENCE_CAP);
        }
    }
}
