package org.dvsim.serialization.text;

import org.dvsim.core.id.RouterIndex;
import org.dvsim.routing.core.ConvergenceListener;
import org.dvsim.routing.core.ConvergenceReport;
import org.dvsim.routing.graph.LinkCost;
import org.dvsim.routing.table.DistanceTable;
import org.dvsim.routing.table.RouteEntry;
import org.dvsim.routing.table.RoutingTable;

import java.io.PrintStream;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Writes distance tables for every round and routing tables after every convergence.
 * <p>
 * Rows and columns cover every router other than the table owner, in label order.
 * </p>
 */
public final class ConsoleTableReporter implements ConvergenceListener {
    public static final String UPDATE_MARKER = "APPLYING UPDATES";

    private static final String HEADER_INDENT = "     ";
    private static final String SEPARATOR = "    ";

    private final PrintStream out;

    public ConsoleTableReporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onRound(int round, DistanceTable distances, RoutingTable routes) {
        RouterIndex routers = distances.routers();
        int n = distances.routerCount();
        for (int node = 0; node < n; node++) {
            out.println();
            out.println("Distance Table of router " + routers.toLabel(node) + " at t=" + round + ":");

            StringJoiner header = new StringJoiner(SEPARATOR, HEADER_INDENT, "");
            for (int destination = 0; destination < n; destination++) {
                if (destination != node) {
                    header.add(routers.toLabel(destination));
                }
            }
            out.println(header);

            for (int via = 0; via < n; via++) {
                if (via == node) {
                    continue;
                }
                StringJoiner row = new StringJoiner(SEPARATOR);
                row.add(routers.toLabel(via));
                for (int destination = 0; destination < n; destination++) {
                    if (destination != node) {
                        row.add(LinkCost.format(distances.get(node, via, destination)));
                    }
                }
                out.println(row);
            }
        }
    }

    @Override
    public void onConverged(ConvergenceReport report, RoutingTable routes) {
        RouterIndex routers = routes.routers();
        for (int node = 0; node < routes.routerCount(); node++) {
            out.println();
            out.println("Routing Table of router " + routers.toLabel(node) + ":");
            for (RouteEntry entry : routes.routes(node)) {
                out.println(entry.getDestination() + "," + entry.getNextHop() + "," + entry.getCost());
            }
        }
        out.flush();
    }

    @Override
    public void onUpdatesApplying(int updateCount) {
        out.println();
        out.println(UPDATE_MARKER);
    }
}
