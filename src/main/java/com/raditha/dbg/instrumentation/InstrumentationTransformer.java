package com.raditha.dbg.instrumentation;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.raditha.dbg.analysis.VariableExtractor;
import com.raditha.dbg.config.InstrumentationConfig;
import com.raditha.dbg.model.BuildMode;
import com.raditha.dbg.model.InspectCall;
import com.raditha.dbg.rendering.ExpressionRenderer;
import com.raditha.dbg.rendering.SourceTextReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns one instrumenting call into the code that replaces it.
 * <p>
 * For production builds the inspected expression itself is returned, so no
 * trace code exists in the output at all. Otherwise the result is
 *
 * <pre>
 * com.raditha.dbg.runtime.Dbg.trace(expr, "/path/Foo.java", 12, "  x + y",
 *         com.raditha.dbg.runtime.Dbg.var("x", x), com.raditha.dbg.runtime.Dbg.var("y", y))
 * </pre>
 *
 * Java evaluates arguments from left to right: {@code expr} runs exactly
 * once and before the variables are read, and {@code trace} returns its
 * value unchanged.
 */
public class InstrumentationTransformer {

    private static final Logger logger = LoggerFactory.getLogger(InstrumentationTransformer.class);

    static final String RUNTIME_CLASS = "com.raditha.dbg.runtime.Dbg";
    static final String TRACE_METHOD = "trace";
    static final String VAR_METHOD = "var";
    static final String NO_FILE = "nofile";

    private static final String INDENT = "  ";

    private final BuildMode mode;
    private final VariableExtractor variableExtractor;
    private final SourceTextReconstructor reconstructor;
    private final ExpressionRenderer renderer;

    public InstrumentationTransformer(InstrumentationConfig config) {
        this(config.mode(), new VariableExtractor(), new SourceTextReconstructor(),
                new ExpressionRenderer(config.lineWidth()));
    }

    public InstrumentationTransformer(BuildMode mode, VariableExtractor variableExtractor,
            SourceTextReconstructor reconstructor, ExpressionRenderer renderer) {
        this.mode = mode;
        this.variableExtractor = variableExtractor;
        this.reconstructor = reconstructor;
        this.renderer = renderer;
    }

    /**
     * Produce the replacement for a marker call.
     *
     * @param call The recognized marker
     * @return The target expression in production mode, a trace call otherwise
     */
    public Expression instrument(InspectCall call) {
        if (mode.isProduction()) {
            return call.target();
        }

        String text = expressionText(call);
        List<String> variables = call.options().showVars()
                ? variableExtractor.extract(call.target())
                : List.of();

        logger.debug("Instrumenting {} with variables {}", call.site(), variables);
        return traceCall(call, text, variables);
    }

    /**
     * The original source lines when they can be recovered, the rendered
     * tree otherwise. Every line is indented by two spaces.
     */
    String expressionText(InspectCall call) {
        return reconstructor.reconstruct(call.site(), call.target())
                .orElseGet(() -> INDENT + renderer.render(call.target()));
    }

    private MethodCallExpr traceCall(InspectCall call, String text, List<String> variables) {
        String file = call.site().hasFile() ? call.site().file().toString() : NO_FILE;

        NodeList<Expression> arguments = new NodeList<>();
        arguments.add(call.target());
        arguments.add(new StringLiteralExpr().setString(file));
        arguments.add(new IntegerLiteralExpr(String.valueOf(call.site().line())));
        arguments.add(new StringLiteralExpr().setString(text));
        for (String variable : variables) {
            arguments.add(new MethodCallExpr(runtimeClass(), VAR_METHOD,
                    new NodeList<>(new StringLiteralExpr(variable), new NameExpr(variable))));
        }
        return new MethodCallExpr(runtimeClass(), TRACE_METHOD, arguments);
    }

    private Expression runtimeClass() {
        return StaticJavaParser.parseExpression(RUNTIME_CLASS);
    }
}
