package org.dvsim.routing.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.dvsim.core.id.RouterIndex;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Mutable undirected link topology over a fixed router set.
 * <p>
 * Stored as a dense symmetric {@code N x N} cost matrix holding
 * {@link LinkCost#UNREACHABLE} where no link exists. Only links change at runtime;
 * the router set is fixed by the {@link RouterIndex}.
 * </p>
 * <ul>
 * <li>{@code cost(a, b) == cost(b, a)} always.</li>
 * <li>No self loops.</li>
 * <li>Mutations are visible to the next engine round immediately.</li>
 * </ul>
 */
public final class Topology {

    @Getter
    @Accessors(fluent = true)
    private final RouterIndex routers;
    private final int[][] costs;

    @Getter
    @Accessors(fluent = true)
    private int linkCount;
    @Getter
    @Accessors(fluent = true)
    private long totalLinkCost;

    /**
     * Creates an empty topology (no links) over the given router set.
     *
     * @param routers router label index.
     */
    public Topology(RouterIndex routers) {
        this.routers = Objects.requireNonNull(routers, "routers");
        int n = routers.size();
        this.costs = new int[n][n];
        for (int[] row : costs) {
            Arrays.fill(row, LinkCost.UNREACHABLE);
        }
    }

    public int routerCount() {
        return costs.length;
    }

    /**
     * Adds, overwrites or deletes the symmetric link {@code a <-> b}.
     *
     * @param a first router index.
     * @param b second router index.
     * @param cost positive cost, or {@link LinkCost#DELETE} to remove the link.
     * @return previous cost of the link, {@link LinkCost#UNREACHABLE} when absent.
     * @throws InvalidCostException if cost is 0 or below -1.
     */
    public int setLink(int a, int b, int cost) {
        LinkCost.requireLinkCost(cost);
        if (cost == LinkCost.DELETE) {
            return removeLink(a, b);
        }
        checkPair(a, b);
        int previous = costs[a][b];
        if (previous == LinkCost.UNREACHABLE) {
            linkCount++;
        } else {
            totalLinkCost -= previous;
        }
        totalLinkCost += cost;
        costs[a][b] = cost;
        costs[b][a] = cost;
        return previous;
    }

    /**
     * Label overload of {@link #setLink(int, int, int)}.
     */
    public int setLink(String a, String b, int cost) {
        return setLink(routers.toIndex(a), routers.toIndex(b), cost);
    }

    /**
     * Removes the symmetric link {@code a <-> b}; absent links are ignored.
     *
     * @return removed cost, {@link LinkCost#UNREACHABLE} when no link existed.
     */
    public int removeLink(int a, int b) {
        checkPair(a, b);
        int previous = costs[a][b];
        if (previous != LinkCost.UNREACHABLE) {
            costs[a][b] = LinkCost.UNREACHABLE;
            costs[b][a] = LinkCost.UNREACHABLE;
            linkCount--;
            totalLinkCost -= previous;
        }
        return previous;
    }

    public int removeLink(String a, String b) {
        return removeLink(routers.toIndex(a), routers.toIndex(b));
    }

    /**
     * Direct link cost, or {@link LinkCost#UNREACHABLE}.
     */
    public int cost(int a, int b) {
        checkIndex(a);
        checkIndex(b);
        if (a == b) {
            return LinkCost.UNREACHABLE;
        }
        return costs[a][b];
    }

    public int cost(String a, String b) {
        return cost(routers.toIndex(a), routers.toIndex(b));
    }

    public boolean hasLink(int a, int b) {
        return cost(a, b) != LinkCost.UNREACHABLE;
    }

    /**
     * Routers directly linked to {@code node}, ascending by index.
     * <p>Computed from the matrix on each call.</p>
     */
    public IntStream neighbors(int node) {
        checkIndex(node);
        int[] row = costs[node];
        return IntStream.range(0, row.length).filter(k -> row[k] != LinkCost.UNREACHABLE);
    }

    private void checkPair(int a, int b) {
        checkIndex(a);
        checkIndex(b);
        if (a == b) {
            throw new IllegalArgumentException("self link not allowed: " + routers.toLabel(a));
        }
    }

    private void checkIndex(int node) {
        if (node < 0 || node >= costs.length) {
            throw new IndexOutOfBoundsException("Router index out of bounds: " + node);
        }
    }
}
