package org.Dirac.routing.graph;

import lombok.Value;
import org.Dirac.routing.geometry.Point;

/**
 * One labelled delivery location. Created once per graph and never mutated.
 */
@Value
public class Vertex {
    /** Label from the ordered alphabet. */
    String label;
    /** Dense index; equals the label's position in the alphabet order. */
    int index;
    /** Location of this vertex. */
    Point point;
}
