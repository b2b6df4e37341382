package com.raditha.dbg.runtime;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Writes trace records to the diagnostic stream.
 * <p>
 * A record becomes one highlighted block:
 *
 * <pre>
 * ./src/main/java/Foo.java:12
 *   x = 7
 *   x + 5 #=&gt; 12
 * </pre>
 *
 * The block is built in memory and written with a single call while holding
 * a process-wide lock, so traces from concurrent threads never interleave.
 */
public class TraceEmitter {

    static final String HIGHLIGHT = "\u001B[41m\u001B[1m";
    static final String CLEAR_LINE = "\u001B[K";
    static final String RESET = "\u001B[0m";
    static final String INDENT = "  ";
    static final String RESULT_MARKER = " #=> ";

    private static final Object OUTPUT_LOCK = new Object();

    private final Supplier<PrintStream> stream;
    private final Supplier<String> workingDirectory;

    /**
     * Emitter for {@code System.err}, resolved on every write so that a
     * redirected stream is honored.
     */
    public TraceEmitter() {
        this(() -> System.err, () -> System.getProperty("user.dir"));
    }

    public TraceEmitter(Supplier<PrintStream> stream, Supplier<String> workingDirectory) {
        this.stream = stream;
        this.workingDirectory = workingDirectory;
    }

    /**
     * Write one trace.
     *
     * @throws UncheckedIOException if the stream reports a write error
     */
    public void emit(TraceRecord trace) {
        String block = format(trace);
        synchronized (OUTPUT_LOCK) {
            PrintStream out = stream.get();
            out.print(block);
            out.flush();
            if (out.checkError()) {
                throw new UncheckedIOException(new IOException("Failed to write trace for " + trace.location()));
            }
        }
    }

    String format(TraceRecord trace) {
        return header(trace.location())
                + variables(trace.bindings())
                + result(trace.expressionText(), trace.resultText());
    }

    String header(Location location) {
        return HIGHLIGHT + CLEAR_LINE + "\n" + shortFileName(location.file()) + ":" + location.line() + "\n";
    }

    String variables(List<VariableBinding> bindings) {
        StringBuilder lines = new StringBuilder();
        for (VariableBinding binding : bindings) {
            lines.append(INDENT).append(binding.name()).append(" = ").append(binding.value())
                    .append(CLEAR_LINE).append('\n');
        }
        return lines.toString();
    }

    String result(String expressionText, String resultText) {
        return expressionText + RESULT_MARKER + resultText + CLEAR_LINE + "\n" + RESET + "\n";
    }

    /**
     * Replace the working directory prefix of a path with {@code .}. Paths
     * outside the working directory are returned unchanged.
     */
    String shortFileName(String file) {
        String cwd = workingDirectory.get();
        if (cwd == null || cwd.isEmpty()) {
            return file;
        }
        String prefix = cwd.endsWith(File.separator) ? cwd : cwd + File.separator;
        if (!file.startsWith(prefix)) {
            return file;
        }
        return "." + File.separator + file.substring(prefix.length());
    }
}
