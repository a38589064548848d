package org.dvsim.routing.core;

import org.dvsim.routing.table.DistanceTable;
import org.dvsim.routing.table.RoutingTable;

/**
 * Callbacks for the convergence lifecycle.
 * <p>
 * Tables passed to callbacks are the engine's live buffers and are only valid for the
 * duration of the call; use {@link DistanceTable#copy()} to keep them.
 * </p>
 */
public interface ConvergenceListener {

    ConvergenceListener NONE = new ConvergenceListener() {
    };

    /**
     * Called with the table state of every reported round, starting with round 0.
     */
    default void onRound(int round, DistanceTable distances, RoutingTable routes) {
    }

    /**
     * Called once per convergence run after the fixpoint round was reported.
     */
    default void onConverged(ConvergenceReport report, RoutingTable routes) {
    }

    /**
     * Called before queued topology edits are applied.
     */
    default void onUpdatesApplying(int updateCount) {
    }
}
