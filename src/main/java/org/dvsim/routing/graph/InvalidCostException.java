package org.dvsim.routing.graph;

/**
 * Thrown when a link cost is neither a positive integer nor the delete sentinel.
 */
public class InvalidCostException extends IllegalArgumentException {
    public InvalidCostException(String message) {
        super(message);
    }
}
