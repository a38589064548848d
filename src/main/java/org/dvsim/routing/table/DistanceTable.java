package org.dvsim.routing.table;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.dvsim.core.id.RouterIndex;
import org.dvsim.routing.graph.LinkCost;
import org.dvsim.routing.graph.Topology;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-router, per-via, per-destination cost estimates.
 * <p>
 * Entry {@code (node, via, destination)} is the cost {@code node} believes it would pay
 * to reach {@code destination} by routing through {@code via}. The row
 * {@code via == node} is the node's own row: its advertised best estimate.
 * Entries with {@code destination == node} are never read or written.
 * </p>
 * <p>
 * Layout is one flat {@code int[]} cube indexed {@code (node * N + via) * N + destination}.
 * </p>
 */
public final class DistanceTable {

    public static final int UNREACHABLE = LinkCost.UNREACHABLE;

    @Getter
    @Accessors(fluent = true)
    private final RouterIndex routers;
    @Getter
    @Accessors(fluent = true)
    private final int routerCount;
    private final int[] cells;

    /**
     * Creates a table with every entry unreachable.
     */
    public DistanceTable(RouterIndex routers) {
        this.routers = Objects.requireNonNull(routers, "routers");
        this.routerCount = routers.size();
        this.cells = new int[Math.multiplyExact(Math.multiplyExact(routerCount, routerCount), routerCount)];
        Arrays.fill(cells, UNREACHABLE);
    }

    /**
     * Builds the round-0 table from direct links only.
     * <p>
     * For each link {@code n - k}: {@code (n, k, k)} and the own-row entry {@code (n, n, k)}
     * both hold the link cost. Everything else stays unreachable.
     * </p>
     *
     * @param topology current topology.
     * @return initialized table.
     */
    public static DistanceTable fromDirectLinks(Topology topology) {
        DistanceTable table = new DistanceTable(topology.routers());
        for (int n = 0; n < table.routerCount; n++) {
            final int node = n;
            topology.neighbors(node).forEach(k -> {
                int cost = topology.cost(node, k);
                table.set(node, k, k, cost);
                table.set(node, node, k, cost);
            });
        }
        return table;
    }

    public int get(int node, int via, int destination) {
        return cells[offset(node, via, destination)];
    }

    public void set(int node, int via, int destination, int cost) {
        cells[offset(node, via, destination)] = cost;
    }

    /**
     * The node's advertised best estimate for {@code destination} (its own row).
     */
    public int advertised(int node, int destination) {
        return get(node, node, destination);
    }

    /**
     * Minimum over all rows {@code via != node} for {@code destination}.
     */
    public int bestViaNeighbors(int node, int destination) {
        int best = UNREACHABLE;
        for (int via = 0; via < routerCount; via++) {
            if (via == node) {
                continue;
            }
            int cost = get(node, via, destination);
            if (cost < best) {
                best = cost;
            }
        }
        return best;
    }

    /**
     * Overwrites this table with {@code other}'s entries.
     */
    public void copyFrom(DistanceTable other) {
        if (other.routerCount != routerCount) {
            throw new IllegalArgumentException(
                    "router count mismatch: " + other.routerCount + " != " + routerCount
            );
        }
        System.arraycopy(other.cells, 0, cells, 0, cells.length);
    }

    /**
     * Returns an independent copy.
     */
    public DistanceTable copy() {
        DistanceTable copy = new DistanceTable(routers);
        copy.copyFrom(this);
        return copy;
    }

    /**
     * Label overload of {@link #get(int, int, int)}.
     */
    public int get(String node, String via, String destination) {
        return get(routers.toIndex(node), routers.toIndex(via), routers.toIndex(destination));
    }

    private int offset(int node, int via, int destination) {
        assert node >= 0 && node < routerCount : "node " + node + " out of bounds";
        assert via >= 0 && via < routerCount : "via " + via + " out of bounds";
        assert destination >= 0 && destination < routerCount : "destination " + destination + " out of bounds";
        return (node * routerCount + via) * routerCount + destination;
    }
}
