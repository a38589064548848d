package org.dvsim.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;
import java.util.List;

/**
 * Bidirectional mapping between router labels and dense integer router indices.
 * <p>
 * Indices are assigned once, in ascending lexicographic label order, so index order
 * and label order always agree. Every table in the engine is addressed by index.
 * </p>
 */
public interface RouterIndex {

    /**
     * Converts a router label to its dense index.
     * @param label The router label.
     * @return The dense index in {@code [0, size)}.
     * @throws UnknownRouterException If the label was not declared.
     */
    int toIndex(String label) throws UnknownRouterException;

    /**
     * Converts a dense index back to its router label.
     * @param index The dense index.
     * @return The router label.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String toLabel(int index);

    /**
     * Checks whether a label was declared.
     *
     * @param label label to test.
     * @return true when the label is present.
     */
    boolean containsLabel(String label);

    /**
     * Returns number of declared routers.
     *
     * @return router count.
     */
    int size();

    /**
     * Returns all labels in index order.
     *
     * @return immutable sorted label list.
     */
    List<String> labels();

    /**
     * Thrown when a router label is not part of the declared router set.
     */
    @StandardException
    class UnknownRouterException extends RuntimeException {
    }

    /**
     * Creates the default immutable index from an unordered label collection.
     *
     * @param labels declared router labels; must be non-empty and free of duplicates.
     * @return immutable index with labels sorted lexicographically.
     */
    static RouterIndex of(Collection<String> labels) {
        return new FastUtilRouterIndex(labels);
    }
}
