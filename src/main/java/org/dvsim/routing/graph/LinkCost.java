package org.dvsim.routing.graph;

import lombok.experimental.UtilityClass;

/**
 * Integer cost arithmetic shared by the topology and the table stores.
 * <p>
 * {@link #UNREACHABLE} behaves as positive infinity: it absorbs addition and never
 * wins a minimum against a finite cost. Exact integer equality is used for change
 * detection, so no floating-point infinity is involved.
 * </p>
 */
@UtilityClass
public class LinkCost {

    /** Sentinel for "no link" and "no known path". */
    public static final int UNREACHABLE = Integer.MAX_VALUE;

    /** Wire-format cost meaning "delete this link". */
    public static final int DELETE = -1;

    /**
     * Returns whether {@code cost} is a finite cost.
     */
    public static boolean isFinite(int cost) {
        return cost != UNREACHABLE;
    }

    /**
     * Adds two costs with infinity semantics.
     * <p>
     * The result is {@link #UNREACHABLE} when either operand is unreachable, when the sum
     * does not fit below the sentinel, or when it exceeds {@code horizon}.
     * </p>
     *
     * @param a first cost.
     * @param b second cost.
     * @param horizon largest cost still considered reachable.
     * @return saturated sum.
     */
    public static int add(int a, int b, long horizon) {
        if (a == UNREACHABLE || b == UNREACHABLE) {
            return UNREACHABLE;
        }
        long sum = (long) a + (long) b;
        if (sum > horizon || sum >= UNREACHABLE) {
            return UNREACHABLE;
        }
        return (int) sum;
    }

    /**
     * Validates a wire-format link cost: positive, or {@link #DELETE}.
     *
     * @throws InvalidCostException when the cost is zero or below {@link #DELETE}.
     */
    public static int requireLinkCost(int cost) {
        if (cost == 0 || cost < DELETE) {
            throw new InvalidCostException("link cost must be > 0 or " + DELETE + " (delete), got " + cost);
        }
        if (cost == UNREACHABLE) {
            throw new InvalidCostException("link cost " + cost + " collides with the unreachable sentinel");
        }
        return cost;
    }

    /**
     * Renders a cost as its integer value or {@code INF}.
     */
    public static String format(int cost) {
        return cost == UNREACHABLE ? "INF" : Integer.toString(cost);
    }
}
