package org.dvsim.app;

import lombok.extern.log4j.Log4j2;
import org.dvsim.routing.core.ConvergenceEngine;
import org.dvsim.routing.core.DistanceVectorException;
import org.dvsim.routing.core.DistanceVectorSimulation;
import org.dvsim.routing.core.EngineConfig;
import org.dvsim.routing.core.SimulationInput;
import org.dvsim.routing.core.SimulationResult;
import org.dvsim.serialization.text.ConsoleTableReporter;
import org.dvsim.serialization.text.InputFormatException;
import org.dvsim.serialization.text.TopologyInputReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point: reads the simulation input from a file or stdin and prints
 * every round's distance tables and the routing tables to stdout.
 */
@Log4j2
public class Main {
    public static final int EXIT_OK = 0;
    public static final int EXIT_INPUT_ERROR = 1;
    public static final int EXIT_NOT_CONVERGED = 2;
    public static final int EXIT_USAGE = 64;

    private static final String USAGE = "usage: dv-sim [input-file]   (reads stdin when no file is given)";

    /**
     * Launches the simulator.
     *
     * @param args optional input file path.
     */
    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs one simulation with explicit streams.
     *
     * @return process exit code.
     */
    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        if (args.length > 1 || (args.length == 1 && ("-h".equals(args[0]) || "--help".equals(args[0])))) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        SimulationInput input;
        try (Reader reader = args.length == 1
                ? Files.newBufferedReader(Path.of(args[0]), StandardCharsets.UTF_8)
                : new InputStreamReader(stdin, StandardCharsets.UTF_8)) {
            input = new TopologyInputReader().read(reader);
        } catch (InputFormatException ex) {
            log.error("Invalid input: {}", ex.getMessage());
            err.println("error: " + ex.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException ex) {
            log.error("Cannot read input", ex);
            err.println("error: cannot read input: " + ex.getMessage());
            return EXIT_INPUT_ERROR;
        }

        DistanceVectorSimulation simulation = DistanceVectorSimulation.builder()
                .config(EngineConfig.defaults())
                .listener(new ConsoleTableReporter(out))
                .build();
        try {
            SimulationResult result = simulation.run(input);
            log.info("Finished at t={}", result.finalRound());
            return EXIT_OK;
        } catch (DistanceVectorException ex) {
            out.flush();
            log.error("Simulation failed: {}", ex.getMessage());
            err.println("error: " + ex.getMessage());
            return ConvergenceEngine.REASON_NOT_CONVERGED.equals(ex.reasonCode())
                    ? EXIT_NOT_CONVERGED
                    : EXIT_INPUT_ERROR;
        }
    }
}
