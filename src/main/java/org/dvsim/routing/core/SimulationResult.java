package org.dvsim.routing.core;

import lombok.Builder;
import lombok.Value;
import org.dvsim.routing.table.DistanceTable;
import org.dvsim.routing.table.RoutingTable;

/**
 * Outcome of a full simulation run.
 */
@Value
@Builder
public class SimulationResult {
    /** Convergence of the initial topology. */
    ConvergenceReport initialConvergence;
    /** Re-convergence after updates, {@code null} when no updates were queued. */
    ConvergenceReport updateConvergence;
    /** Number of edits applied. */
    int updatesApplied;
    /** Final distance tables (independent copy). */
    DistanceTable distanceTable;
    /** Final routing tables (independent copy). */
    RoutingTable routingTable;

    public boolean hasUpdatePhase() {
        return updateConvergence != null;
    }

    /**
     * Last round number emitted by the simulation.
     */
    public int finalRound() {
        return hasUpdatePhase() ? updateConvergence.getLastRound() : initialConvergence.getLastRound();
    }
}
