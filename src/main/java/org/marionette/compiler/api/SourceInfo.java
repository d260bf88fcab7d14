package org.marionette.compiler.api;

/**
 * A pure data class representing a position in the manifest source.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical name of the manifest.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Position used when a diagnostic cannot be attributed to a source location. */
    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", 0, 0);

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
