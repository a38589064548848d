package org.dvsim.routing.core;

import org.dvsim.routing.graph.Topology;
import org.dvsim.routing.testutil.RoutingFixtureFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Engine Config Tests")
class EngineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(EngineConfig.PROP_MAX_ROUNDS);
        System.clearProperty(EngineConfig.PROP_INFINITY_HORIZON);
    }

    @Test
    @DisplayName("Builder without values uses defaults")
    void testBuilderDefaults() {
        EngineConfig config = EngineConfig.builder().build();

        assertEquals(EngineConfig.DEFAULT_MAX_ROUNDS, config.maxRounds());
        assertEquals(EngineConfig.TOPOLOGY_HORIZON, config.infinityHorizon());
    }

    @Test
    @DisplayName("Builder rejects non-positive round bound and negative horizon")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().maxRounds(0).build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().maxRounds(-3).build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().infinityHorizon(-1L).build());
    }

    @Test
    @DisplayName("System properties override defaults")
    void testSystemProperties() {
        System.setProperty(EngineConfig.PROP_MAX_ROUNDS, "25");
        System.setProperty(EngineConfig.PROP_INFINITY_HORIZON, " 16 ");

        EngineConfig config = EngineConfig.defaults();

        assertEquals(25, config.maxRounds());
        assertEquals(16L, config.infinityHorizon());
    }

    @Test
    @DisplayName("Malformed or out-of-range properties fall back to defaults")
    void testMalformedProperties() {
        System.setProperty(EngineConfig.PROP_MAX_ROUNDS, "lots");
        System.setProperty(EngineConfig.PROP_INFINITY_HORIZON, "-4");

        EngineConfig config = EngineConfig.defaults();

        assertEquals(EngineConfig.DEFAULT_MAX_ROUNDS, config.maxRounds());
        assertEquals(EngineConfig.TOPOLOGY_HORIZON, config.infinityHorizon());

        System.setProperty(EngineConfig.PROP_MAX_ROUNDS, "99999999999");
        assertEquals(EngineConfig.DEFAULT_MAX_ROUNDS, EngineConfig.defaults().maxRounds());
    }

    @Test
    @DisplayName("Horizon follows the topology unless fixed")
    void testHorizonFor() {
        Topology topology = RoutingFixtureFactory.topology(
                java.util.List.of("A", "B", "C"), "A B 3", "B C 4");

        assertEquals(7L, EngineConfig.builder().build().horizonFor(topology));
        assertEquals(16L, EngineConfig.builder().infinityHorizon(16L).build().horizonFor(topology));

        topology.removeLink("A", "B");
        assertEquals(4L, EngineConfig.builder().build().horizonFor(topology));
    }
}
