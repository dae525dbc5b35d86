package org.Dirac.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable LabelIndex backed by a fastutil {@code Object2IntOpenHashMap}.
 *
 * <p>Label lookups return primitive ints; index lookups read a plain array.</p>
 */
public class FastUtilLabelIndex implements LabelIndex {

    // label -> index, -1 when absent
    private final Object2IntOpenHashMap<String> forward;
    // index -> label
    private final String[] reverse;
    private final List<String> labels;

    /**
     * Builds the index from labels in their fixed order.
     * Rejects null, blank and duplicate labels.
     */
    public FastUtilLabelIndex(List<String> orderedLabels) {
        if (orderedLabels == null) {
            throw new IllegalArgumentException("Labels cannot be null");
        }
        int size = orderedLabels.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String label = requireLabel(orderedLabels.get(i), i);
            if (forward.containsKey(label)) {
                throw new IllegalArgumentException("Duplicate label detected at index " + i + ": " + label);
            }
            forward.put(label, i);
            reverse[i] = label;
        }

        this.forward.trim();
        this.labels = List.of(reverse);
    }

    private static String requireLabel(String label, int index) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label at index " + index + " must be non-blank");
        }
        return label;
    }

    @Override
    public int toIndex(String label) throws UnknownLabelException {
        if (label == null) {
            throw new UnknownLabelException("Label must be non-null");
        }
        int index = forward.getInt(label);
        if (index == -1) {
            throw new UnknownLabelException("Unknown vertex label: " + label);
        }
        return index;
    }

    @Override
    public String toLabel(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("Vertex index out of bounds: " + index);
        }
        return reverse[index];
    }

    @Override
    public boolean containsLabel(String label) {
        return label != null && forward.containsKey(label);
    }

    @Override
    public int size() {
        return reverse.length;
    }

    @Override
    public List<String> labels() {
        return labels;
    }
}
