package org.calista.r3.axiom;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AxiomGrounderTest {

    private final AxiomGrounder grounder = new AxiomGrounder(() -> 1_000L);

    @Nested
    @DisplayName("ground")
    class Ground {

        @Test
        void ground_shouldProveIdentityStatementWithFullCertainty() {
            // Act
            GroundedStatement g = grounder.ground("A = A", Map.of());

            // Assert
            assertThat(g.contains(Axioms.IDENTITY, "identity")).isTrue();
            assertThat(g.steps).filteredOn(s -> s.axiom.equals(Axioms.IDENTITY))
                    .singleElement()
                    .satisfies(s -> assertThat(s.certainty).isEqualTo(1.0));
            assertThat(g.steps).extracting(s -> s.axiom)
                    .containsExactly("A1", "A2", "A4", "A5", "A6");
            assertThat(g.certainty).isEqualTo(1.0);
            assertThat(g.fallback).isFalse();
            assertThat(g.verifyProof()).isTrue();
        }

        @Test
        void ground_shouldAddNonContradictionStepWhenStatementCarriesMarker() {
            GroundedStatement g = grounder.ground("it is raining and not raining", Map.of());

            assertThat(g.contains(Axioms.NON_CONTRADICTION, "contradiction_elimination")).isTrue();
            assertThat(g.steps).hasSize(6);
            assertThat(g.axiomsUsed).containsExactly("A1", "A2", "A3", "A4", "A5", "A6");
        }

        @Test
        void ground_shouldBeDeterministicAcrossInstancesAndClocks() {
            AxiomGrounder other = new AxiomGrounder(() -> 99_999L);

            GroundedStatement a = grounder.ground("All men are mortal", Map.of("k", 1));
            GroundedStatement b = other.ground("All men are mortal", Map.of());

            assertThat(a.hash).isEqualTo(b.hash);
            assertThat(a.steps).isEqualTo(b.steps);
            assertThat(a.timestampEpochMs).isNotEqualTo(b.timestampEpochMs);
            assertThat(a.hash).isEqualTo(GroundedStatement.hashOf(a.statement, a.steps));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "x", "What is consciousness?", "yes no paradox", "∀x ∃y: x ≠ y"})
        void ground_shouldKeepCertaintyInUnitInterval(String statement) {
            GroundedStatement g = grounder.ground(statement, null);

            assertThat(g.certainty).isBetween(0.0, 1.0);
            assertThat(g.verifyProof()).isTrue();
            assertThat(g.steps.get(0).axiom).isEqualTo(Axioms.EXISTENCE);
        }

        @Test
        void ground_shouldRecordConservationByteCount() {
            GroundedStatement g = grounder.ground("héllo", Map.of());

            assertThat(g.steps).filteredOn(s -> s.axiom.equals(Axioms.CONSERVATION))
                    .singleElement()
                    .satisfies(s -> assertThat(s.result).isEqualTo("Information conserved (6 bytes)"));
        }
    }

    @Nested
    @DisplayName("groundWithProof")
    class WithProof {

        @Test
        void groundWithProof_shouldFallBackToMinimalGroundingOnInvalidStep() {
            // Arrange
            List<ProofStep> bad = List.of(
                    new ProofStep(Axioms.EXISTENCE, "existential", "ok", 1.0),
                    new ProofStep(Axioms.NON_CONTRADICTION, "identity", "wrong vocabulary", 1.0));

            // Act
            GroundedStatement g = grounder.groundWithProof("x", bad);

            // Assert
            assertThat(g.fallback).isTrue();
            assertThat(g.certainty).isEqualTo(AxiomGrounder.FALLBACK_CERTAINTY);
            assertThat(g.steps).singleElement().satisfies(s -> {
                assertThat(s.axiom).isEqualTo(Axioms.EXISTENCE);
                assertThat(s.result).isEqualTo("unproven");
            });
        }

        @Test
        void groundWithProof_shouldFallBackOnEmptyOrUnknownAxiom() {
            assertThat(grounder.groundWithProof("x", List.of()).fallback).isTrue();
            assertThat(grounder.groundWithProof("x",
                    List.of(new ProofStep("A9", "identity", "", 1.0))).fallback).isTrue();
        }

        @Test
        void groundWithProof_shouldAcceptValidCallerProof() {
            List<ProofStep> steps = List.of(new ProofStep(Axioms.CONSERVATION, "invariance", "kept", 0.5));

            GroundedStatement g = grounder.groundWithProof("x", steps);

            assertThat(g.fallback).isFalse();
            assertThat(g.certainty).isCloseTo(0.5 + 0.05 + 0.1 / 6, within(1e-12));
        }
    }

    @Nested
    @DisplayName("certaintyOf")
    class Certainty {

        @Test
        void certaintyOf_shouldApplyFloorForStrongLongProofs() {
            double c = 0.8625;
            List<ProofStep> steps = List.of(
                    new ProofStep("A1", "existential", "", c),
                    new ProofStep("A2", "identity", "", c),
                    new ProofStep("A3", "negation", "", c),
                    new ProofStep("A4", "choice", "", c));

            assertThat(AxiomGrounder.certaintyOf(steps)).isEqualTo(0.85);
        }

        @Test
        void certaintyOf_shouldNotFloorShortProofs() {
            List<ProofStep> steps = List.of(
                    new ProofStep("A1", "existential", "", 0.7),
                    new ProofStep("A2", "identity", "", 0.9));

            assertThat(AxiomGrounder.certaintyOf(steps)).isCloseTo(0.63 + 0.1 + 2 * 0.1 / 6, within(1e-12));
        }

        @Test
        void certaintyOf_shouldBeZeroForEmptyProof() {
            assertThat(AxiomGrounder.certaintyOf(List.of())).isZero();
            assertThat(AxiomGrounder.certaintyOf(null)).isZero();
        }
    }

    @Test
    void stats_shouldCountGroundingsFallbacksAndKnownProofs() {
        GroundedStatement a = grounder.ground("A = A", Map.of());
        grounder.ground("B", Map.of());
        grounder.groundWithProof("C", List.of());

        AxiomGrounder.Stats s = grounder.stats();

        assertThat(s.totalGrounded).isEqualTo(3);
        assertThat(s.fallbacks).isEqualTo(1);
        assertThat(s.axiomsLoaded).isEqualTo(6);
        assertThat(s.proofCacheSize).isEqualTo(3);
        assertThat(s.avgCertainty).isCloseTo((1.0 + 1.0 + 0.1) / 3, within(1e-12));
        assertThat(grounder.isKnownProof(a.hash)).isTrue();
        assertThat(grounder.isKnownProof("nope")).isFalse();
    }

    @Test
    void axioms_shouldRejectTransformationsOutsideVocabulary() {
        assertThat(Axioms.isAllowed("A6", "emergence_potential")).isTrue();
        assertThat(Axioms.isAllowed("A2", "negation")).isFalse();
        assertThat(Axioms.get("A7")).isEmpty();
        assertThat(Axioms.all()).extracting(a -> a.id).containsExactly("A1", "A2", "A3", "A4", "A5", "A6");
    }
}
