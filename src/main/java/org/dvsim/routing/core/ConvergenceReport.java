package org.dvsim.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable summary of one convergence run.
 */
@Value
@Builder
public class ConvergenceReport {
    /** First round produced by this run. */
    int firstRound;
    /** Fixpoint round (the first sweep without changes). */
    int lastRound;
    /** Number of relaxation sweeps executed, including the final unchanged one. */
    int sweeps;
    /** Total (node, destination) selections that changed across the run. */
    long changedSelections;
    /** Effective infinity horizon at the fixpoint round. */
    long horizon;
}
