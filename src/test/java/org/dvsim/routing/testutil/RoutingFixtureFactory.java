package org.dvsim.routing.testutil;

import org.dvsim.core.id.RouterIndex;
import org.dvsim.routing.core.ConvergenceEngine;
import org.dvsim.routing.core.ConvergenceListener;
import org.dvsim.routing.core.EngineConfig;
import org.dvsim.routing.graph.LinkCost;
import org.dvsim.routing.graph.Topology;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Shared topology fixtures and a Floyd-Warshall reference for routing tests.
 */
public final class RoutingFixtureFactory {

    private RoutingFixtureFactory() {
    }

    /**
     * Builds a topology from {@code "A B 1"} link strings.
     */
    public static Topology topology(List<String> routers, String... links) {
        Topology topology = new Topology(RouterIndex.of(routers));
        for (String link : links) {
            String[] parts = link.trim().split("\\s+");
            topology.setLink(parts[0], parts[1], Integer.parseInt(parts[2]));
        }
        return topology;
    }

    /**
     * A - B - C with unit costs and no A-C link.
     */
    public static Topology line3() {
        return topology(List.of("A", "B", "C"), "A B 1", "B C 1");
    }

    public static ConvergenceEngine engine(Topology topology) {
        return engine(topology, EngineConfig.builder().build(), ConvergenceListener.NONE);
    }

    public static ConvergenceEngine engine(Topology topology, EngineConfig config, ConvergenceListener listener) {
        ConvergenceEngine engine = new ConvergenceEngine(topology, config, listener);
        engine.initialize();
        return engine;
    }

    /**
     * Random connected topology: a random spanning tree plus {@code extraLinks} chords.
     */
    public static Topology randomConnected(long seed, int routerCount, int extraLinks, int maxCost) {
        Random random = new Random(seed);
        List<String> labels = new ArrayList<>(routerCount);
        for (int i = 0; i < routerCount; i++) {
            labels.add(String.format("R%02d", i));
        }
        Topology topology = new Topology(RouterIndex.of(labels));
        for (int i = 1; i < routerCount; i++) {
            int parent = random.nextInt(i);
            topology.setLink(i, parent, 1 + random.nextInt(maxCost));
        }
        for (int e = 0; e < extraLinks; e++) {
            int a = random.nextInt(routerCount);
            int b = random.nextInt(routerCount);
            if (a != b) {
                topology.setLink(a, b, 1 + random.nextInt(maxCost));
            }
        }
        return topology;
    }

    /**
     * All-pairs shortest path costs; unreachable pairs hold {@link LinkCost#UNREACHABLE}.
     */
    public static int[][] floydWarshall(Topology topology) {
        int n = topology.routerCount();
        long[][] dist = new long[n][n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(dist[i], Long.MAX_VALUE);
            dist[i][i] = 0;
            for (int j = 0; j < n; j++) {
                if (i != j && topology.hasLink(i, j)) {
                    dist[i][j] = topology.cost(i, j);
                }
            }
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (dist[i][k] == Long.MAX_VALUE) {
                    continue;
                }
                for (int j = 0; j < n; j++) {
                    if (dist[k][j] != Long.MAX_VALUE && dist[i][k] + dist[k][j] < dist[i][j]) {
                        dist[i][j] = dist[i][k] + dist[k][j];
                    }
                }
            }
        }
        int[][] result = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = dist[i][j] == Long.MAX_VALUE ? LinkCost.UNREACHABLE : (int) dist[i][j];
            }
        }
        return result;
    }
}
