package io.github.eutro.wasmslice.core.analysis;

import org.intellij.lang.annotations.PrintFormat;

/**
 * Thrown when an analysis finds its input violating one of its invariants,
 * such as a stack underflow, a variable defined twice, or a use with no definition.
 * <p>
 * These are never recovered from: the annotations of the graph are not usable afterwards.
 */
public class AnalysisException extends RuntimeException {
    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Create an exception with a formatted message.
     *
     * @param format The format string.
     * @param args   The format arguments.
     * @return The exception, to be thrown by the caller.
     */
    public static AnalysisException format(@PrintFormat String format, Object... args) {
        return new AnalysisException(String.format(format, args));
    }
}
