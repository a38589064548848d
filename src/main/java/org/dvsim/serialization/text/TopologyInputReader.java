package org.dvsim.serialization.text;

import lombok.extern.log4j.Log4j2;
import org.dvsim.routing.core.SimulationInput;
import org.dvsim.routing.graph.LinkCost;
import org.dvsim.routing.overlay.LinkUpdate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses the three-block text input into a {@link SimulationInput}.
 * <pre>
 * X
 * Y
 * START
 * X Y 2
 * UPDATE
 * X Y -1
 * END
 * </pre>
 * Lines are trimmed and blank lines skipped. Any malformed line is fatal.
 */
@Log4j2
public final class TopologyInputReader {
    public static final String START = "START";
    public static final String UPDATE = "UPDATE";
    public static final String END = "END";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private int lineNumber;

    /**
     * Reads a complete input.
     *
     * @param source character source; not closed by this method.
     * @return parsed simulation input.
     * @throws InputFormatException on any malformed or inconsistent line.
     * @throws IOException if reading fails.
     */
    public SimulationInput read(Reader source) throws InputFormatException, IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);
        lineNumber = 0;

        SimulationInput.SimulationInputBuilder builder = SimulationInput.builder();
        Set<String> routers = new HashSet<>();

        String line;
        while (!START.equals(line = nextLine(reader, START))) {
            if (WHITESPACE.matcher(line).find()) {
                throw new InputFormatException(lineNumber, "router label must not contain whitespace: '" + line + "'");
            }
            if (!routers.add(line)) {
                throw new InputFormatException(lineNumber, "duplicate router label: " + line);
            }
            builder.router(line);
        }
        if (routers.isEmpty()) {
            throw new InputFormatException(lineNumber, "no routers declared before " + START);
        }

        while (!UPDATE.equals(line = nextLine(reader, UPDATE))) {
            LinkUpdate link = parseTriple(line, routers);
            if (!link.isRemoval()) {
                builder.link(link);
            }
        }

        int updateCount = 0;
        while (!END.equals(line = nextLine(reader, END))) {
            builder.update(parseTriple(line, routers));
            updateCount++;
        }

        SimulationInput input = builder.build();
        log.debug("Parsed {} routers, {} links, {} updates", routers.size(), input.getLinks().size(), updateCount);
        return input;
    }

    /**
     * Convenience overload for in-memory input.
     */
    public SimulationInput read(String text) throws InputFormatException {
        try {
            return read(new StringReader(text));
        } catch (IOException ex) {
            throw new IllegalStateException("StringReader cannot fail", ex);
        }
    }

    private String nextLine(BufferedReader reader, String terminator) throws IOException, InputFormatException {
        String raw;
        while ((raw = reader.readLine()) != null) {
            lineNumber++;
            String line = raw.trim();
            if (!line.isEmpty()) {
                return line;
            }
        }
        throw new InputFormatException(0, "unexpected end of input, expected " + terminator);
    }

    private LinkUpdate parseTriple(String line, Set<String> routers) throws InputFormatException {
        String[] tokens = WHITESPACE.split(line);
        if (tokens.length != 3) {
            throw new InputFormatException(lineNumber, "expected 'src dest cost', got '" + line + "'");
        }
        requireRouter(tokens[0], routers);
        requireRouter(tokens[1], routers);

        int cost;
        try {
            cost = Integer.parseInt(tokens[2]);
        } catch (NumberFormatException ex) {
            throw new InputFormatException(lineNumber, "cost is not an integer: '" + tokens[2] + "'", ex);
        }
        if (cost == 0 || cost < LinkCost.DELETE) {
            throw new InputFormatException(lineNumber, "cost must be > 0 or " + LinkCost.DELETE + ", got " + cost);
        }

        try {
            return LinkUpdate.of(tokens[0], tokens[1], cost);
        } catch (IllegalArgumentException ex) {
            throw new InputFormatException(lineNumber, ex.getMessage(), ex);
        }
    }

    private void requireRouter(String label, Set<String> routers) throws InputFormatException {
        if (!routers.contains(label)) {
            throw new InputFormatException(lineNumber, "unknown router: " + label);
        }
    }
}
