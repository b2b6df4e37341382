package com.raditha.dbg.model;

import java.util.Locale;

/**
 * Build configuration the instrumentation is generated for.
 * Only {@link #PRODUCTION} disables tracing.
 */
public enum BuildMode {
    DEVELOPMENT,
    TEST,
    PRODUCTION;

    public boolean isProduction() {
        return this == PRODUCTION;
    }

    /**
     * Parse a mode name. Unknown or missing values resolve to
     * {@link #DEVELOPMENT} so that diagnostics are kept rather than dropped.
     */
    public static BuildMode fromString(String value) {
        if (value == null) {
            return DEVELOPMENT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "prod", "production" -> PRODUCTION;
            case "test" -> TEST;
            default -> DEVELOPMENT;
        };
    }
}
