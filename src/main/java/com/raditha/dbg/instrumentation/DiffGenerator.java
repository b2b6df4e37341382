package com.raditha.dbg.instrumentation;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for dry-run previews of a rewrite.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the original and the rewritten source.
     *
     * @param result Outcome of instrumenting one file
     * @return Unified diff as string, empty when nothing changed
     */
    public String generateUnifiedDiff(InstrumentationResult result) {
        return generateUnifiedDiff(result, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(InstrumentationResult result, int contextLines) {
        if (!result.isModified()) {
            return "";
        }
        List<String> original = lines(result.originalCode());
        List<String> revised = lines(result.rewrittenCode());

        Patch<String> patch = DiffUtils.diff(original, revised);

        String name = result.file() == null ? "source" : result.file().getFileName().toString();
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + name,
                "b/" + name,
                original,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String code) {
        return Arrays.asList(code.split("\r?\n", -1));
    }
}
