package org.Dirac.routing.degree;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;

import java.util.Objects;

/**
 * Immutable label to incident-edge-count mapping.
 *
 * <p>Iteration follows label order for stable presentation; only the values matter
 * for the Dirac check.</p>
 */
public final class DegreeMap {
    private final Object2IntMap<String> degrees;
    private final int minDegree;

    DegreeMap(Object2IntLinkedOpenHashMap<String> degrees) {
        Objects.requireNonNull(degrees, "degrees");
        degrees.defaultReturnValue(-1);
        this.degrees = Object2IntMaps.unmodifiable(degrees);
        int min = Integer.MAX_VALUE;
        for (Object2IntMap.Entry<String> entry : degrees.object2IntEntrySet()) {
            min = Math.min(min, entry.getIntValue());
        }
        this.minDegree = degrees.isEmpty() ? 0 : min;
    }

    /**
     * @throws IllegalArgumentException if the label has no entry.
     */
    public int degreeOf(String label) {
        int degree = degrees.getInt(label);
        if (degree < 0) {
            throw new IllegalArgumentException("no degree recorded for label: " + label);
        }
        return degree;
    }

    /**
     * Smallest degree over all vertices, 0 for an empty map.
     */
    public int minDegree() {
        return minDegree;
    }

    public int size() {
        return degrees.size();
    }

    /**
     * Read-only view in label order.
     */
    public Object2IntMap<String> asMap() {
        return degrees;
    }

    @Override
    public String toString() {
        return degrees.toString();
    }
}
