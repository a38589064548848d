package org.dvsim.routing.table;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.dvsim.core.id.RouterIndex;
import org.dvsim.routing.graph.LinkCost;
import org.dvsim.routing.graph.Topology;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-router, per-destination selected next hop and cost.
 * <p>
 * Rows are only written by the convergence engine from the matching
 * {@link DistanceTable}; {@link #NO_ROUTE} marks destinations without a finite estimate.
 * </p>
 */
public final class RoutingTable {

    public static final int NO_ROUTE = -1;

    @Getter
    @Accessors(fluent = true)
    private final RouterIndex routers;
    @Getter
    @Accessors(fluent = true)
    private final int routerCount;
    private final int[] nextHops;
    private final int[] costs;

    public RoutingTable(RouterIndex routers) {
        this.routers = Objects.requireNonNull(routers, "routers");
        this.routerCount = routers.size();
        int cellCount = Math.multiplyExact(routerCount, routerCount);
        this.nextHops = new int[cellCount];
        this.costs = new int[cellCount];
        Arrays.fill(nextHops, NO_ROUTE);
        Arrays.fill(costs, LinkCost.UNREACHABLE);
    }

    /**
     * Round-0 routing: every direct neighbor is its own next hop.
     */
    public static RoutingTable fromDirectLinks(Topology topology) {
        RoutingTable table = new RoutingTable(topology.routers());
        for (int n = 0; n < table.routerCount; n++) {
            final int node = n;
            topology.neighbors(node).forEach(k -> table.set(node, k, k, topology.cost(node, k)));
        }
        return table;
    }

    public int nextHop(int node, int destination) {
        return nextHops[offset(node, destination)];
    }

    public int cost(int node, int destination) {
        return costs[offset(node, destination)];
    }

    public void set(int node, int destination, int nextHop, int cost) {
        int offset = offset(node, destination);
        if (nextHop == NO_ROUTE || cost == LinkCost.UNREACHABLE) {
            nextHops[offset] = NO_ROUTE;
            costs[offset] = LinkCost.UNREACHABLE;
            return;
        }
        nextHops[offset] = nextHop;
        costs[offset] = cost;
    }

    /**
     * Label of the next hop from {@code node} to {@code destination}, or {@code null}.
     */
    public String nextHop(String node, String destination) {
        int hop = nextHop(routers.toIndex(node), routers.toIndex(destination));
        return hop == NO_ROUTE ? null : routers.toLabel(hop);
    }

    public int cost(String node, String destination) {
        return cost(routers.toIndex(node), routers.toIndex(destination));
    }

    /**
     * Reachable routes of {@code node}, ordered by destination label.
     *
     * @param node router index.
     * @return immutable list; unreachable destinations and the node itself are omitted.
     */
    public List<RouteEntry> routes(int node) {
        List<RouteEntry> entries = new ArrayList<>();
        for (int destination = 0; destination < routerCount; destination++) {
            if (destination == node) {
                continue;
            }
            int hop = nextHop(node, destination);
            if (hop == NO_ROUTE) {
                continue;
            }
            entries.add(new RouteEntry(routers.toLabel(destination), routers.toLabel(hop), cost(node, destination)));
        }
        return Collections.unmodifiableList(entries);
    }

    public List<RouteEntry> routes(String node) {
        return routes(routers.toIndex(node));
    }

    public void copyFrom(RoutingTable other) {
        if (other.routerCount != routerCount) {
            throw new IllegalArgumentException(
                    "router count mismatch: " + other.routerCount + " != " + routerCount
            );
        }
        System.arraycopy(other.nextHops, 0, nextHops, 0, nextHops.length);
        System.arraycopy(other.costs, 0, costs, 0, costs.length);
    }

    public RoutingTable copy() {
        RoutingTable copy = new RoutingTable(routers);
        copy.copyFrom(this);
        return copy;
    }

    private int offset(int node, int destination) {
        assert node >= 0 && node < routerCount : "node " + node + " out of bounds";
        assert destination >= 0 && destination < routerCount : "destination " + destination + " out of bounds";
        return node * routerCount + destination;
    }
}
