package org.Dirac.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between vertex labels and dense vertex indices.
 *
 * <p>Index order is the label order fixed at graph construction, so every
 * ordering-sensitive algorithm (permutation scan, tie-breaking) walks indices
 * ascending.</p>
 */
public interface LabelIndex {

    /**
     * Converts a vertex label to its dense index.
     * @param label the client-facing label.
     * @return the internal index.
     * @throws UnknownLabelException If the label is not part of the graph.
     */
    int toIndex(String label) throws UnknownLabelException;

    /**
     * Converts a dense index back to its label.
     * @param index the internal index.
     * @return the label.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String toLabel(int index);

    /**
     * Checks whether a label is mapped.
     *
     * @param label label to test.
     * @return true when the label is present.
     */
    boolean containsLabel(String label);

    /**
     * Returns number of mapped labels.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Returns labels in index order.
     *
     * @return immutable ordered label list.
     */
    List<String> labels();

    /**
     * Exception thrown when a label cannot be found in the mapping.
     */
    @StandardException
    class UnknownLabelException extends IllegalArgumentException {
    }

    /**
     * Creates the default immutable index over labels in the given order.
     * Position in the list becomes the index.
     *
     * @param orderedLabels distinct, non-blank labels.
     * @return an immutable LabelIndex instance.
     */
    static LabelIndex of(List<String> orderedLabels) {
        return new FastUtilLabelIndex(orderedLabels);
    }
}
