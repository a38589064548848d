package org.dvsim.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.log4j.Log4j2;
import org.dvsim.routing.graph.LinkCost;
import org.dvsim.routing.graph.Topology;
import org.dvsim.routing.table.DistanceTable;
import org.dvsim.routing.table.RoutingTable;

import java.util.Objects;

/**
 * Synchronous distance-vector relaxation engine.
 * <p>
 * One round recomputes every router's table from the previous round's snapshot:
 * </p>
 * <ol>
 * <li>For router {@code n}, destination {@code d != n} and every router {@code k != n}:
 *     row {@code (n, k, d)} becomes {@code cost(n, d)} when {@code k == d}, otherwise
 *     {@code cost(n, k) + advertised(k, d)}. Rows through routers that are not linked to
 *     {@code n} come out unreachable because {@code cost(n, k)} is.</li>
 * <li>The selected cost is the minimum over those rows; it is written to the own row
 *     {@code (n, n, d)}, which is what {@code n} advertises next round.</li>
 * <li>Next hop: the previous next hop if it still achieves the minimum, else the direct
 *     link, else the lowest-index router achieving it.</li>
 * </ol>
 * <p>
 * Writes go to a second buffer that is swapped in at the end of the round, so the
 * iteration order of routers never leaks into results. Tables are built once by
 * {@link #initialize()} and then only relaxed; topology edits between runs are picked up
 * by the next round (warm start). No split horizon or poison reverse is applied, so
 * link removal shows count-to-infinity, bounded by {@link EngineConfig#horizonFor}.
 * </p>
 */
@Log4j2
public final class ConvergenceEngine {
    public static final String REASON_NOT_CONVERGED = "DV_NOT_CONVERGED";
    public static final String REASON_NOT_INITIALIZED = "DV_NOT_INITIALIZED";
    public static final String REASON_ALREADY_INITIALIZED = "DV_ALREADY_INITIALIZED";

    private final Topology topology;
    @Getter
    @Accessors(fluent = true)
    private final EngineConfig config;
    private final ConvergenceListener listener;
    private final int routerCount;

    private DistanceTable distances;
    private DistanceTable scratchDistances;
    private RoutingTable routes;
    private RoutingTable scratchRoutes;

    /** Last reported round, -1 before initialization. */
    @Getter
    @Accessors(fluent = true)
    private int round = -1;

    public ConvergenceEngine(Topology topology, EngineConfig config, ConvergenceListener listener) {
        this.topology = Objects.requireNonNull(topology, "topology");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = listener == null ? ConvergenceListener.NONE : listener;
        this.routerCount = topology.routerCount();
    }

    public ConvergenceEngine(Topology topology) {
        this(topology, EngineConfig.defaults(), ConvergenceListener.NONE);
    }

    /**
     * Builds the round-0 tables from direct links and reports round 0.
     *
     * @throws DistanceVectorException if the engine was already initialized.
     */
    public void initialize() {
        if (isInitialized()) {
            throw new DistanceVectorException(
                    REASON_ALREADY_INITIALIZED,
                    "tables are built once; re-converge instead of re-initializing"
            );
        }
        distances = DistanceTable.fromDirectLinks(topology);
        routes = RoutingTable.fromDirectLinks(topology);
        scratchDistances = new DistanceTable(topology.routers());
        scratchRoutes = new RoutingTable(topology.routers());
        round = 0;
        log.debug("Initialized {} routers with {} links", routerCount, topology.linkCount());
        listener.onRound(round, distances, routes);
    }

    public boolean isInitialized() {
        return distances != null;
    }

    /**
     * Runs rounds from the current table state until one produces no change.
     *
     * @return summary of this run.
     * @throws DistanceVectorException with {@link #REASON_NOT_CONVERGED} when
     * {@link EngineConfig#maxRounds()} changing sweeps do not reach a fixpoint.
     */
    public ConvergenceReport converge() {
        requireInitialized();
        int firstRound = round + 1;
        int sweeps = 0;
        long changedSelections = 0;
        while (true) {
            int changed = sweep();
            sweeps++;
            changedSelections += changed;
            if (changed == 0) {
                break;
            }
            if (sweeps >= config.maxRounds()) {
                log.warn("No fixpoint after {} rounds (last round {} changed {} selections)",
                        sweeps, round, changed);
                throw new DistanceVectorException(
                        REASON_NOT_CONVERGED,
                        "did not converge within " + config.maxRounds() + " rounds (last round t=" + round + ")"
                );
            }
        }

        ConvergenceReport report = ConvergenceReport.builder()
                .firstRound(firstRound)
                .lastRound(round)
                .sweeps(sweeps)
                .changedSelections(changedSelections)
                .horizon(config.horizonFor(topology))
                .build();
        log.info("Converged at t={} after {} rounds", report.getLastRound(), report.getSweeps());
        listener.onConverged(report, routes);
        return report;
    }

    /**
     * Executes and reports one synchronous round.
     *
     * @return number of (node, destination) pairs whose selected cost or next hop changed.
     */
    public int sweep() {
        requireInitialized();
        long horizon = config.horizonFor(topology);
        int changed = 0;
        for (int node = 0; node < routerCount; node++) {
            for (int destination = 0; destination < routerCount; destination++) {
                if (destination == node) {
                    continue;
                }
                if (relax(node, destination, horizon)) {
                    changed++;
                }
            }
        }

        DistanceTable previousDistances = distances;
        distances = scratchDistances;
        scratchDistances = previousDistances;
        RoutingTable previousRoutes = routes;
        routes = scratchRoutes;
        scratchRoutes = previousRoutes;

        round++;
        log.debug("t={} changed {} selections (horizon {})", round, changed, horizon);
        listener.onRound(round, distances, routes);
        return changed;
    }

    /**
     * Recomputes all rows of {@code (node, destination)} into the scratch buffers.
     *
     * @return whether the selected cost or next hop changed.
     */
    private boolean relax(int node, int destination, long horizon) {
        int best = LinkCost.UNREACHABLE;
        for (int via = 0; via < routerCount; via++) {
            if (via == node) {
                continue;
            }
            int link = topology.cost(node, via);
            int candidate = via == destination
                    ? LinkCost.add(link, 0, horizon)
                    : LinkCost.add(link, distances.advertised(via, destination), horizon);
            scratchDistances.set(node, via, destination, candidate);
            if (candidate < best) {
                best = candidate;
            }
        }

        int nextHop = selectNextHop(node, destination, best);
        scratchDistances.set(node, node, destination, best);
        scratchRoutes.set(node, destination, nextHop, best);

        return best != routes.cost(node, destination) || nextHop != routes.nextHop(node, destination);
    }

    private int selectNextHop(int node, int destination, int best) {
        if (best == LinkCost.UNREACHABLE) {
            return RoutingTable.NO_ROUTE;
        }
        int previous = routes.nextHop(node, destination);
        if (previous != RoutingTable.NO_ROUTE && scratchDistances.get(node, previous, destination) == best) {
            return previous;
        }
        if (scratchDistances.get(node, destination, destination) == best) {
            return destination;
        }
        for (int via = 0; via < routerCount; via++) {
            if (via != node && scratchDistances.get(node, via, destination) == best) {
                return via;
            }
        }
        throw new IllegalStateException("no row achieves selected cost " + best);
    }

    /**
     * Current distance table (live buffer, replaced every round).
     */
    public DistanceTable distanceTable() {
        requireInitialized();
        return distances;
    }

    /**
     * Current routing table (live buffer, replaced every round).
     */
    public RoutingTable routingTable() {
        requireInitialized();
        return routes;
    }

    public Topology topology() {
        return topology;
    }

    private void requireInitialized() {
        if (!isInitialized()) {
            throw new DistanceVectorException(REASON_NOT_INITIALIZED, "initialize() must run before relaxation");
        }
    }
}
