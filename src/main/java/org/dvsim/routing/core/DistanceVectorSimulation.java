package org.dvsim.routing.core;

import lombok.Builder;
import lombok.extern.log4j.Log4j2;
import org.dvsim.core.id.RouterIndex;
import org.dvsim.routing.graph.InvalidCostException;
import org.dvsim.routing.graph.Topology;
import org.dvsim.routing.overlay.LinkUpdate;
import org.dvsim.routing.overlay.UpdateApplier;

import java.util.Objects;

/**
 * End-to-end simulation entry point.
 *
 * <p>Each run owns its own router index, topology and engine; nothing is shared between
 * runs. Execution flow:</p>
 * <ul>
 * <li>Map labels to dense indices and build the topology from the initial links.</li>
 * <li>Initialize tables from direct links (round 0) and converge.</li>
 * <li>If updates are queued: apply them and converge again from the current tables.</li>
 * <li>Wrap input contract failures into {@link DistanceVectorException} with stable reason codes.</li>
 * </ul>
 */
@Log4j2
public final class DistanceVectorSimulation {
    public static final String REASON_INPUT_REQUIRED = "DV_INPUT_REQUIRED";
    public static final String REASON_INVALID_ROUTER_SET = "DV_INVALID_ROUTER_SET";
    public static final String REASON_UNKNOWN_ROUTER = "DV_UNKNOWN_ROUTER";
    public static final String REASON_INVALID_LINK = "DV_INVALID_LINK";

    private final EngineConfig config;
    private final ConvergenceListener listener;

    /**
     * @param config convergence bounds; {@link EngineConfig#defaults()} when null.
     * @param listener round/convergence observer; no-op when null.
     */
    @Builder
    public DistanceVectorSimulation(EngineConfig config, ConvergenceListener listener) {
        this.config = config == null ? EngineConfig.defaults() : config;
        this.listener = listener == null ? ConvergenceListener.NONE : listener;
    }

    /**
     * Runs initial convergence and, when present, the update phase.
     *
     * @param input routers, links and queued updates.
     * @return reports and final tables.
     * @throws DistanceVectorException on invalid input or non-convergence.
     */
    public SimulationResult run(SimulationInput input) {
        if (input == null) {
            throw new DistanceVectorException(REASON_INPUT_REQUIRED, "simulation input must be provided");
        }
        Topology topology = buildTopology(input);
        log.info("Simulating {} routers, {} links, {} queued updates",
                topology.routerCount(), topology.linkCount(), input.getUpdates().size());

        ConvergenceEngine engine = new ConvergenceEngine(topology, config, listener);
        engine.initialize();
        ConvergenceReport initial = engine.converge();

        ConvergenceReport afterUpdates = null;
        if (!input.getUpdates().isEmpty()) {
            listener.onUpdatesApplying(input.getUpdates().size());
            UpdateApplier applier = new UpdateApplier(engine);
            try {
                afterUpdates = applier.applyAndReconverge(input.getUpdates());
            } catch (RouterIndex.UnknownRouterException ex) {
                throw new DistanceVectorException(REASON_UNKNOWN_ROUTER, ex.getMessage(), ex);
            }
        }

        return SimulationResult.builder()
                .initialConvergence(initial)
                .updateConvergence(afterUpdates)
                .updatesApplied(input.getUpdates().size())
                .distanceTable(engine.distanceTable().copy())
                .routingTable(engine.routingTable().copy())
                .build();
    }

    private static Topology buildTopology(SimulationInput input) {
        RouterIndex routers;
        try {
            routers = RouterIndex.of(input.getRouters());
        } catch (IllegalArgumentException ex) {
            throw new DistanceVectorException(REASON_INVALID_ROUTER_SET, ex.getMessage(), ex);
        }

        Topology topology = new Topology(routers);
        for (LinkUpdate link : input.getLinks()) {
            Objects.requireNonNull(link, "link");
            try {
                topology.setLink(link.source(), link.destination(), link.cost());
            } catch (RouterIndex.UnknownRouterException ex) {
                throw new DistanceVectorException(REASON_UNKNOWN_ROUTER, ex.getMessage(), ex);
            } catch (InvalidCostException ex) {
                throw new DistanceVectorException(REASON_INVALID_LINK, ex.getMessage(), ex);
            }
        }
        return topology;
    }
}
