package org.Dirac.core.id;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered single-letter vertex alphabet: the first point is {@code A}, the second {@code B}, and so on.
 */
@UtilityClass
public class LabelAlphabet {
    public static final int MAX_SIZE = 26;

    /**
     * Returns the first {@code count} labels of the alphabet in order.
     *
     * @param count number of labels, in {@code [0, 26]}.
     * @return immutable label list.
     */
    public static List<String> firstLabels(int count) {
        if (count < 0 || count > MAX_SIZE) {
            throw new IllegalArgumentException("label count must be in [0, " + MAX_SIZE + "]: " + count);
        }
        List<String> labels = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            labels.add(String.valueOf((char) ('A' + i)));
        }
        return Collections.unmodifiableList(labels);
    }
}
