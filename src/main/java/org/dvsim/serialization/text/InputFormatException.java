package org.dvsim.serialization.text;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fatal problem in the line-oriented simulation input.
 */
@Getter
@Accessors(fluent = true)
public class InputFormatException extends Exception {
    /** 1-based line number, or 0 when the problem is not tied to a line (e.g. early EOF). */
    private final int lineNumber;

    public InputFormatException(int lineNumber, String message) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public InputFormatException(int lineNumber, String message, Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }
}
