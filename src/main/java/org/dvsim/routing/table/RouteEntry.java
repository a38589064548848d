package org.dvsim.routing.table;

import lombok.Value;

/**
 * One reachable routing-table row: destination, next hop and selected cost.
 */
@Value
public class RouteEntry {
    /** Destination router label. */
    String destination;
    /** Neighbor through which the best path starts. */
    String nextHop;
    /** Selected (finite) cost. */
    int cost;
}
