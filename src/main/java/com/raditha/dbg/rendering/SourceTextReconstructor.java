package com.raditha.dbg.rendering;

import com.github.javaparser.ast.expr.Expression;
import com.raditha.dbg.analysis.SourceRangeLocator;
import com.raditha.dbg.model.CallSite;
import com.raditha.dbg.model.SourceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recovers the original text of a multi-line fluent chain that is fed into a
 * chained marker call:
 *
 * <pre>
 * list.stream()
 *     .map(String::valueOf)
 *     .toList()
 *     .dbg();
 * </pre>
 *
 * The lines of the chain are copied verbatim from the source file, so the
 * author's line breaks survive. When any condition for this is not met the
 * result is empty and the caller renders the tree instead.
 */
public class SourceTextReconstructor {

    private static final Logger logger = LoggerFactory.getLogger(SourceTextReconstructor.class);

    static final String CONTINUATION_TOKEN = ".";
    static final String INDENT = "  ";

    private final SourceRangeLocator rangeLocator;

    public SourceTextReconstructor() {
        this(new SourceRangeLocator());
    }

    public SourceTextReconstructor(SourceRangeLocator rangeLocator) {
        this.rangeLocator = rangeLocator;
    }

    /**
     * Attempt to reconstruct the source text of an expression.
     *
     * @param site       Location of the instrumenting call
     * @param expression The inspected expression
     * @return The original lines, re-indented to two spaces, or empty
     */
    public Optional<String> reconstruct(CallSite site, Expression expression) {
        if (!site.hasFile()) {
            return Optional.empty();
        }

        SourceRange range = rangeLocator.locate(expression);
        if (!range.isMultiLine() || range.lineMax() >= site.line()) {
            return Optional.empty();
        }

        Path file = site.file();
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            logger.debug("Source of {} is not readable, rendering the expression instead", site);
            return Optional.empty();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            logger.debug("Could not read {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        if (site.line() > lines.size()) {
            return Optional.empty();
        }
        String callLine = lines.get(site.line() - 1).trim();
        if (!callLine.startsWith(CONTINUATION_TOKEN)) {
            return Optional.empty();
        }

        List<String> selected = new ArrayList<>(lines.subList(range.lineMin() - 1, range.lineMax()));
        trimToExpression(selected, expression, range);
        return Optional.of(reindent(selected));
    }

    /**
     * Drop whatever shares the first and last line with the expression. Text
     * in front of the chain, such as {@code return}, is blanked so that the
     * first line keeps the column the expression starts at.
     */
    private static void trimToExpression(List<String> selected, Expression expression, SourceRange range) {
        int last = selected.size() - 1;
        expression.getEnd()
                .filter(end -> end.line == range.lineMax())
                .ifPresent(end -> selected.set(last, cut(selected.get(last), 0, end.column)));
        expression.getBegin()
                .filter(begin -> begin.line == range.lineMin())
                .ifPresent(begin -> selected.set(0, blankBefore(selected.get(0), begin.column - 1)));
    }

    private static String cut(String line, int from, int to) {
        int end = Math.min(to, line.length());
        return line.substring(Math.min(from, end), end);
    }

    private static String blankBefore(String line, int column) {
        int start = Math.min(column, line.length());
        return " ".repeat(start) + line.substring(start);
    }

    /**
     * Remove the indentation all non-blank lines have in common, then indent
     * every line by two spaces.
     */
    static String reindent(List<String> lines) {
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isBlank()) {
                common = Math.min(common, leadingWhitespace(line));
            }
        }

        StringBuilder text = new StringBuilder();
        for (String line : lines) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(INDENT).append(line.substring(Math.min(common, leadingWhitespace(line))));
        }
        return text.toString();
    }

    private static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }
}
