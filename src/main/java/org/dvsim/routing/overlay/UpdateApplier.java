package org.dvsim.routing.overlay;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.log4j.Log4j2;
import org.dvsim.routing.core.ConvergenceEngine;
import org.dvsim.routing.core.ConvergenceReport;
import org.dvsim.routing.graph.LinkCost;
import org.dvsim.routing.graph.Topology;

import java.util.List;
import java.util.Objects;

/**
 * Applies queued link edits to a topology and re-converges from the existing tables.
 * <p>
 * Edits are applied in list order, so the last edit to a pair wins. The engine's tables
 * are never reset: a removed link only changes {@code cost(a, b)}, and the relaxation
 * rounds carry the consequences, including stale, too-low estimates that count up
 * until they cross the infinity horizon.
 * </p>
 */
@Log4j2
public final class UpdateApplier {

    /**
     * Counters for one {@link #apply(List)} call.
     */
    @Getter
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    @Accessors(fluent = true)
    public static final class ApplyResult {
        /** Links that did not exist before. */
        private final int added;
        /** Existing links whose cost was overwritten (including same-cost overwrites). */
        private final int changed;
        /** Existing links that were deleted. */
        private final int removed;
        /** Removals of links that did not exist. */
        private final int ignoredRemovals;
    }

    private final Topology topology;
    private final ConvergenceEngine engine;

    public UpdateApplier(ConvergenceEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.topology = engine.topology();
    }

    /**
     * Applies {@code updates} to the topology in order without touching any table.
     *
     * @param updates ordered edits.
     * @return counters for the batch.
     */
    public ApplyResult apply(List<LinkUpdate> updates) {
        Objects.requireNonNull(updates, "updates");
        // resolve every label first so a bad batch leaves the topology untouched
        for (LinkUpdate update : updates) {
            Objects.requireNonNull(update, "update");
            topology.routers().toIndex(update.source());
            topology.routers().toIndex(update.destination());
        }

        int added = 0;
        int changed = 0;
        int removed = 0;
        int ignoredRemovals = 0;
        for (LinkUpdate update : updates) {
            int previous = topology.setLink(update.source(), update.destination(), update.cost());
            boolean existed = previous != LinkCost.UNREACHABLE;
            if (update.isRemoval()) {
                if (existed) {
                    removed++;
                } else {
                    ignoredRemovals++;
                    log.debug("Removal of absent link {}-{} ignored", update.source(), update.destination());
                }
            } else if (existed) {
                changed++;
            } else {
                added++;
            }
        }
        log.info("Applied {} updates: {} added, {} changed, {} removed, {} ignored",
                updates.size(), added, changed, removed, ignoredRemovals);
        return new ApplyResult(added, changed, removed, ignoredRemovals);
    }

    /**
     * Applies {@code updates} and re-runs convergence from the current tables.
     *
     * @param updates ordered edits.
     * @return report of the re-convergence run.
     */
    public ConvergenceReport applyAndReconverge(List<LinkUpdate> updates) {
        apply(updates);
        return engine.converge();
    }
}
