package com.raditha.dbg.config;

import com.raditha.dbg.model.BuildMode;

import java.util.List;

/**
 * Settings of one preprocessing run.
 *
 * @param mode            Build mode; {@link BuildMode#PRODUCTION} strips all markers
 * @param markerClass     Simple name of the class of the direct marker ({@code Dbg})
 * @param markerMethod    Method of the direct marker ({@code inspect})
 * @param chainMethod     Method name of the chained marker ({@code dbg})
 * @param lineWidth       Line width used when rendering expressions
 * @param includeTests    Also rewrite files under test source folders
 * @param excludePatterns File patterns to leave untouched (glob format)
 */
public record InstrumentationConfig(
        BuildMode mode,
        String markerClass,
        String markerMethod,
        String chainMethod,
        int lineWidth,
        boolean includeTests,
        List<String> excludePatterns) {

    public static final String DEFAULT_MARKER_CLASS = "Dbg";
    public static final String DEFAULT_MARKER_METHOD = "inspect";
    public static final String DEFAULT_CHAIN_METHOD = "dbg";
    public static final int DEFAULT_LINE_WIDTH = 60;

    /**
     * Validate configuration.
     */
    public InstrumentationConfig {
        if (mode == null) {
            mode = BuildMode.DEVELOPMENT;
        }
        requireIdentifier(markerClass, "markerClass");
        requireIdentifier(markerMethod, "markerMethod");
        requireIdentifier(chainMethod, "chainMethod");
        if (lineWidth < 10) {
            throw new IllegalArgumentException("lineWidth must be >= 10");
        }
        if (excludePatterns == null) {
            excludePatterns = List.of();
        }
    }

    /**
     * Development build with the default marker names.
     */
    public static InstrumentationConfig defaults() {
        return forMode(BuildMode.DEVELOPMENT);
    }

    public static InstrumentationConfig forMode(BuildMode mode) {
        return new InstrumentationConfig(
                mode,
                DEFAULT_MARKER_CLASS,
                DEFAULT_MARKER_METHOD,
                DEFAULT_CHAIN_METHOD,
                DEFAULT_LINE_WIDTH,
                true,
                List.of());
    }

    public InstrumentationConfig withMode(BuildMode newMode) {
        return new InstrumentationConfig(newMode, markerClass, markerMethod, chainMethod, lineWidth,
                includeTests, excludePatterns);
    }

    /**
     * Check if a file path matches any exclusion pattern, or is a test source
     * while tests are not included.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        if (!includeTests && normalized.contains("/src/test/")) {
            return true;
        }
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards.
     */
    private boolean matchesGlobPattern(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("**", "\u0000")
                .replace("*", "[^/]*")
                .replace("\u0000", ".*");
        return path.matches(regex);
    }

    private static void requireIdentifier(String value, String field) {
        if (value == null || value.isBlank() || !Character.isJavaIdentifierStart(value.charAt(0))) {
            throw new IllegalArgumentException(field + " must be a Java identifier, got: " + value);
        }
    }
}
