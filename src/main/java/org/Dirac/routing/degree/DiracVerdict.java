package org.Dirac.routing.degree;

import lombok.Value;

/**
 * Outcome of the Dirac sufficient-degree check.
 *
 * <p>{@code satisfied=true} guarantees a Hamiltonian cycle exists. {@code false} proves
 * nothing: the graph may still be Hamiltonian.</p>
 */
@Value
public class DiracVerdict {
    /** Degrees per vertex label. */
    DegreeMap degrees;
    /** Number of vertices in the evaluated graph. */
    int vertexCount;
    /** Real-valued degree threshold {@code n / 2}. */
    double threshold;
    /** Whether every vertex meets the threshold and {@code n >= 3}. */
    boolean satisfied;
}
