package org.Dirac.routing.degree;

import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.testutil.LayoutFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dirac Evaluator Tests")
class DiracEvaluatorTest {

    @Test
    @DisplayName("Complete unit square: every degree 3 >= 2, condition holds")
    void testCompleteGraphSatisfies() {
        DiracVerdict verdict = DiracEvaluator.evaluate(LayoutFixtureFactory.unitSquare(1.5));

        assertTrue(verdict.isSatisfied());
        assertEquals(4, verdict.getVertexCount());
        assertEquals(2.0d, verdict.getThreshold(), 0.0d);
        assertEquals(3, verdict.getDegrees().minDegree());
        for (String label : List.of("A", "B", "C", "D")) {
            assertEquals(3, verdict.getDegrees().degreeOf(label));
        }
    }

    @Test
    @DisplayName("Square sides only: degree 2 meets n/2 exactly")
    void testBoundaryDegreeSatisfies() {
        DiracVerdict verdict = DiracEvaluator.evaluate(LayoutFixtureFactory.unitSquare(1.0));

        assertTrue(verdict.isSatisfied());
        assertEquals(2, verdict.getDegrees().minDegree());
    }

    @Test
    @DisplayName("Empty graph violates the condition")
    void testEmptyGraphViolates() {
        DiracVerdict verdict = DiracEvaluator.evaluate(LayoutFixtureFactory.unitSquare(0.9));

        assertFalse(verdict.isSatisfied());
        assertEquals(0, verdict.getDegrees().minDegree());
    }

    @Test
    @DisplayName("Real-valued threshold: pentagon degree 2 < 2.5 fails although floor(5/2) = 2")
    void testRealValuedThreshold() {
        DiracVerdict verdict = DiracEvaluator.evaluate(LayoutFixtureFactory.pentagon(0.6));

        assertEquals(2.5d, verdict.getThreshold(), 0.0d);
        assertEquals(2, verdict.getDegrees().minDegree());
        assertFalse(verdict.isSatisfied());
    }

    @Test
    @DisplayName("Fewer than 3 vertices is never satisfied")
    void testTooFewVertices() {
        ProximityGraph pair = LayoutFixtureFactory.graph(1.0, 0.1, 0.1, 0.2, 0.2);
        DiracVerdict verdict = DiracEvaluator.evaluate(pair);

        assertEquals(1, verdict.getDegrees().minDegree());
        assertFalse(verdict.isSatisfied());
        assertFalse(DiracEvaluator.evaluate(LayoutFixtureFactory.graph(1.0, 0.5, 0.5)).isSatisfied());
    }

    @Test
    @DisplayName("One isolated vertex breaks an otherwise dense graph")
    void testSingleLowDegreeVertexViolates() {
        // A, B, C, D clustered; E far away in the corner.
        ProximityGraph graph = LayoutFixtureFactory.graph(0.3,
                0.1, 0.1, 0.2, 0.1, 0.1, 0.2, 0.2, 0.2, 0.9, 0.9);
        DiracVerdict verdict = DiracEvaluator.evaluate(graph);

        assertEquals(3, verdict.getDegrees().degreeOf("A"));
        assertEquals(0, verdict.getDegrees().degreeOf("E"));
        assertFalse(verdict.isSatisfied());
    }

    @Test
    @DisplayName("Verdict equals min degree >= n/2 across random layouts")
    void testVerdictMatchesMinDegree() {
        for (long seed = 0; seed < 100; seed++) {
            int n = 4 + (int) (seed % 7);
            double radius = 0.2 + (seed % 5) * 0.1;
            ProximityGraph graph = LayoutFixtureFactory.seeded(n, radius, seed);
            DiracVerdict verdict = DiracEvaluator.evaluate(graph);

            int min = Integer.MAX_VALUE;
            for (int i = 0; i < n; i++) {
                min = Math.min(min, graph.degree(i));
            }
            assertEquals(min, verdict.getDegrees().minDegree());
            assertEquals(min >= n / 2.0d, verdict.isSatisfied(), "seed " + seed);
        }
    }

    @Test
    @DisplayName("Degree map iterates in label order and rejects unknown labels")
    void testDegreeMapShape() {
        DegreeMap degrees = DiracEvaluator.degrees(LayoutFixtureFactory.unitSquare(1.0));

        assertEquals(List.of("A", "B", "C", "D"), List.copyOf(degrees.asMap().keySet()));
        assertEquals(4, degrees.size());
        assertThrows(IllegalArgumentException.class, () -> degrees.degreeOf("Z"));
        assertThrows(UnsupportedOperationException.class, () -> degrees.asMap().put("Z", 1));
    }
}
