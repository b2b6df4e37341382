package com.raditha.dbg.model;

import java.nio.file.Path;

/**
 * Where an instrumenting call appears in the host sources.
 *
 * @param file Source file, or null when the code was parsed from a string
 * @param line Line of the marker method name (1-indexed)
 */
public record CallSite(Path file, int line) {

    public CallSite {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got: " + line);
        }
    }

    /**
     * A call site without a backing file (snippets, generated code).
     */
    public static CallSite ephemeral(int line) {
        return new CallSite(null, line);
    }

    public boolean hasFile() {
        return file != null;
    }

    @Override
    public String toString() {
        return (file == null ? "<none>" : file.toString()) + ":" + line;
    }
}
