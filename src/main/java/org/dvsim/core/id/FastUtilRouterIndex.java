package org.dvsim.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Immutable {@link RouterIndex} backed by a fastutil label map and a sorted label array.
 */
public class FastUtilRouterIndex implements RouterIndex {

    // label -> index, -1 when missing
    private final Object2IntOpenHashMap<String> forward;
    // index -> label, sorted
    private final String[] reverse;
    private final List<String> labels;

    /**
     * Builds the index, sorting labels so index order matches label order.
     */
    public FastUtilRouterIndex(Collection<String> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("Router labels cannot be null");
        }
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("Router set must not be empty");
        }

        List<String> sorted = new ArrayList<>(labels.size());
        for (String label : labels) {
            sorted.add(requireLabel(label));
        }
        Collections.sort(sorted);

        this.forward = new Object2IntOpenHashMap<>(sorted.size());
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[sorted.size()];

        for (int i = 0; i < sorted.size(); i++) {
            String label = sorted.get(i);
            if (forward.containsKey(label)) {
                throw new IllegalArgumentException("Duplicate router label: " + label);
            }
            forward.put(label, i);
            reverse[i] = label;
        }
        this.forward.trim();
        this.labels = List.of(reverse);
    }

    private static String requireLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Router label must be non-blank");
        }
        return label;
    }

    @Override
    public int toIndex(String label) throws UnknownRouterException {
        int index = forward.getInt(label);
        if (index == -1) {
            throw new UnknownRouterException("Unknown router: " + label);
        }
        return index;
    }

    @Override
    public String toLabel(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("Router index out of bounds: " + index);
        }
        return reverse[index];
    }

    @Override
    public boolean containsLabel(String label) {
        return forward.containsKey(label);
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
