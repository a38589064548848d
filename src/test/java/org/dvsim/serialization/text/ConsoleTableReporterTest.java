package org.dvsim.serialization.text;

import org.dvsim.routing.core.ConvergenceEngine;
import org.dvsim.routing.core.EngineConfig;
import org.dvsim.routing.testutil.RoutingFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Console Table Reporter Tests")
class ConsoleTableReporterTest {

    private static List<String> lines(ByteArrayOutputStream buffer) {
        return buffer.toString(StandardCharsets.UTF_8).lines().collect(Collectors.toList());
    }

    @Test
    @DisplayName("Round 0 prints one distance table per router, excluding the owner")
    void testRoundZeroTables() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleTableReporter reporter = new ConsoleTableReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        RoutingFixtureFactory.engine(RoutingFixtureFactory.line3(), EngineConfig.builder().build(), reporter);

        assertEquals(List.of(
                "",
                "Distance Table of router A at t=0:",
                "     B    C",
                "B    1    INF",
                "C    INF    INF",
                "",
                "Distance Table of router B at t=0:",
                "     A    C",
                "A    1    INF",
                "C    INF    1",
                "",
                "Distance Table of router C at t=0:",
                "     A    B",
                "A    INF    INF",
                "B    INF    1"
        ), lines(buffer));
    }

    @Test
    @DisplayName("Routing tables list finite routes as destination,next hop,cost")
    void testRoutingTables() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleTableReporter reporter = new ConsoleTableReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        ConvergenceEngine engine = RoutingFixtureFactory.engine(
                RoutingFixtureFactory.line3(), EngineConfig.builder().build(), reporter);
        engine.converge();

        List<String> output = lines(buffer);
        int start = output.indexOf("Routing Table of router A:");
        assertTrue(start > 0);
        assertEquals("", output.get(start - 1));
        assertEquals(List.of(
                "Routing Table of router A:",
                "B,B,1",
                "C,B,2",
                "",
                "Routing Table of router B:",
                "A,A,1",
                "C,C,1",
                "",
                "Routing Table of router C:",
                "A,B,2",
                "B,B,1"
        ), output.subList(start, output.size()));
        assertTrue(output.contains("Distance Table of router A at t=2:"));
        assertFalse(output.contains("Distance Table of router A at t=3:"));
    }

    @Test
    @DisplayName("Update marker is preceded by a blank line")
    void testUpdateMarker() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ConsoleTableReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).onUpdatesApplying(2);

        assertEquals(List.of("", ConsoleTableReporter.UPDATE_MARKER), lines(buffer));
    }
}
