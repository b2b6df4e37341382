package com.raditha.dbg.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for instrumented code.
 * <p>
 * In sources, write {@code Dbg.inspect(expr)} or {@code Dbg.inspect(expr, true)}
 * (the latter also prints the variables used by {@code expr}), or append
 * {@code .dbg()} / {@code .dbg(true)} to a fluent chain. The dbg-inspect
 * preprocessor rewrites those calls into {@link #trace} calls, or removes
 * them entirely for production builds.
 */
public final class Dbg {

    private static volatile TraceEmitter emitter = new TraceEmitter();
    private static volatile ValueRenderer renderer = new InspectValueRenderer();

    private Dbg() {
        /* static entry points only */
    }

    /**
     * Marker for the preprocessor. Sources that were not preprocessed still
     * compile and simply get the value back.
     */
    public static <T> T inspect(T value) {
        return value;
    }

    /**
     * Marker for the preprocessor with the {@code showVars} option.
     */
    public static <T> T inspect(T value, boolean showVars) {
        return value;
    }

    /**
     * Print a trace for an evaluated expression and hand the value back.
     * Generated code passes the expression as the first argument so it is
     * evaluated once, before the variables are read.
     *
     * @param result         The value of the inspected expression
     * @param file           Source file of the call site
     * @param line           Line of the call site
     * @param expressionText Indented source text of the expression
     * @param bindings       Variables and their current values
     * @return {@code result}, unchanged
     */
    public static <T> T trace(T result, String file, int line, String expressionText, Binding... bindings) {
        ValueRenderer values = renderer;
        List<VariableBinding> rendered = new ArrayList<>(bindings.length);
        for (Binding binding : bindings) {
            rendered.add(new VariableBinding(binding.name(), values.render(binding.value())));
        }
        emitter.emit(new TraceRecord(new Location(file, line), expressionText, rendered, values.render(result)));
        return result;
    }

    /**
     * Capture a variable for {@link #trace}.
     */
    public static Binding var(String name, Object value) {
        return new Binding(name, value);
    }

    /**
     * Replace the renderer used for values in traces.
     */
    public static void setValueRenderer(ValueRenderer valueRenderer) {
        renderer = valueRenderer == null ? new InspectValueRenderer() : valueRenderer;
    }

    static void setEmitter(TraceEmitter traceEmitter) {
        emitter = traceEmitter == null ? new TraceEmitter() : traceEmitter;
    }
}
