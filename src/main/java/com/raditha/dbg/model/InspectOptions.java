package com.raditha.dbg.model;

/**
 * Options given at an instrumented call site.
 *
 * @param showVars Also print the values of the variables used in the expression
 */
public record InspectOptions(boolean showVars) {

    private static final InspectOptions DEFAULTS = new InspectOptions(false);

    public static InspectOptions defaults() {
        return DEFAULTS;
    }

    public static InspectOptions showingVars() {
        return new InspectOptions(true);
    }
}
