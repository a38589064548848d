package org.dvsim.routing.core;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.dvsim.routing.graph.Topology;

/**
 * Convergence bounds for one engine.
 * <p>
 * {@code maxRounds} caps the sweeps of a single convergence run; exceeding it is reported
 * as non-convergence. {@code infinityHorizon} is the largest cost still treated as
 * reachable; {@code 0} derives it from the topology each round (sum of all link costs,
 * an upper bound on any simple path).
 * </p>
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class EngineConfig {
    public static final int DEFAULT_MAX_ROUNDS = 10_000;
    public static final long TOPOLOGY_HORIZON = 0L;

    static final String PROP_MAX_ROUNDS = "dvsim.engine.maxRounds";
    static final String PROP_INFINITY_HORIZON = "dvsim.engine.infinityHorizon";

    private final int maxRounds;
    private final long infinityHorizon;

    @Builder
    private EngineConfig(Integer maxRounds, Long infinityHorizon) {
        int rounds = maxRounds == null ? DEFAULT_MAX_ROUNDS : maxRounds;
        long horizon = infinityHorizon == null ? TOPOLOGY_HORIZON : infinityHorizon;
        if (rounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be > 0");
        }
        if (horizon < 0) {
            throw new IllegalArgumentException("infinityHorizon must be >= 0");
        }
        this.maxRounds = rounds;
        this.infinityHorizon = horizon;
    }

    /**
     * Loads bounds from system properties; missing or malformed values use the defaults.
     */
    public static EngineConfig defaults() {
        return EngineConfig.builder()
                .maxRounds((int) readPositive(PROP_MAX_ROUNDS, DEFAULT_MAX_ROUNDS))
                .infinityHorizon(readPositive(PROP_INFINITY_HORIZON, TOPOLOGY_HORIZON))
                .build();
    }

    /**
     * Effective horizon for the current topology.
     */
    public long horizonFor(Topology topology) {
        if (infinityHorizon > 0) {
            return infinityHorizon;
        }
        return Math.max(0L, topology.totalLinkCost());
    }

    private static long readPositive(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value <= 0 || value > Integer.MAX_VALUE) {
                return fallback;
            }
            return value;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
