package org.marionette.compiler.diagnostics;

import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The machine-readable error code.
 * @param message The diagnostic message.
 * @param source The position in the manifest the diagnostic refers to.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourceInfo source
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, source, message);
    }
}
