package com.raditha.dbg.instrumentation;

import java.nio.file.Path;

/**
 * Outcome of rewriting one compilation unit.
 *
 * @param file          Source file, null for snippets
 * @param originalCode  Source before the rewrite
 * @param rewrittenCode Source after the rewrite
 * @param sites         Number of marker calls that were replaced
 */
public record InstrumentationResult(
        Path file,
        String originalCode,
        String rewrittenCode,
        int sites) {

    public boolean isModified() {
        return sites > 0;
    }
}
