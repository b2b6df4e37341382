package com.raditha.dbg.runtime;

import java.util.List;

/**
 * Everything printed for one evaluation of an instrumented expression.
 *
 * @param location       Call site
 * @param expressionText Source text of the expression, every line indented
 * @param bindings       Variables to print before the result, possibly empty
 * @param resultText     Rendered result
 */
public record TraceRecord(
        Location location,
        String expressionText,
        List<VariableBinding> bindings,
        String resultText) {

    public TraceRecord {
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }
}
