package com.raditha.dbg.instrumentation;

import com.github.javaparser.Position;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.raditha.dbg.config.InstrumentationConfig;
import com.raditha.dbg.model.CallSite;
import com.raditha.dbg.model.InspectCall;
import com.raditha.dbg.model.InspectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Recognizes instrumenting calls in a syntax tree:
 * <ul>
 * <li>{@code Dbg.inspect(expr)} and {@code Dbg.inspect(expr, true)}; the class
 * may be fully qualified</li>
 * <li>{@code expr.dbg()} and {@code expr.dbg(true)}</li>
 * </ul>
 * The optional argument must be a boolean literal. Calls with any other
 * argument shape are left alone.
 */
public class InspectCallMatcher {

    private static final Logger logger = LoggerFactory.getLogger(InspectCallMatcher.class);

    private final InstrumentationConfig config;

    public InspectCallMatcher(InstrumentationConfig config) {
        this.config = config;
    }

    /**
     * Match a method call against the marker shapes.
     *
     * @param call       Candidate call
     * @param sourceFile File the call was parsed from, null for snippets
     * @return The recognized call, empty if it is not a marker
     */
    public Optional<InspectCall> match(MethodCallExpr call, Path sourceFile) {
        String name = call.getNameAsString();
        Optional<Expression> scope = call.getScope();

        if (name.equals(config.markerMethod()) && scope.filter(this::isMarkerClass).isPresent()) {
            return matchArguments(call, call.getArguments(), 1, sourceFile, InspectCall.Form.DIRECT);
        }
        if (name.equals(config.chainMethod()) && scope.isPresent()) {
            return matchArguments(call, call.getArguments(), 0, sourceFile, InspectCall.Form.CHAINED);
        }
        return Optional.empty();
    }

    private Optional<InspectCall> matchArguments(MethodCallExpr call, NodeList<Expression> arguments,
            int targetArguments, Path sourceFile, InspectCall.Form form) {
        if (arguments.size() != targetArguments && arguments.size() != targetArguments + 1) {
            return Optional.empty();
        }

        InspectOptions options = InspectOptions.defaults();
        if (arguments.size() == targetArguments + 1) {
            Expression option = arguments.get(targetArguments);
            if (!(option instanceof BooleanLiteralExpr showVars)) {
                logger.warn("Ignoring {} at {}: the showVars option must be a boolean literal, got '{}'",
                        call.getNameAsString(), lineOf(call).map(String::valueOf).orElse("?"), option);
                return Optional.empty();
            }
            options = new InspectOptions(showVars.getValue());
        }

        Optional<Integer> line = lineOf(call);
        if (line.isEmpty()) {
            logger.debug("Skipping {} without position information", call);
            return Optional.empty();
        }

        Expression target = form == InspectCall.Form.DIRECT
                ? arguments.get(0)
                : call.getScope().orElseThrow();
        return Optional.of(new InspectCall(call, target, options, new CallSite(sourceFile, line.get()), form));
    }

    private boolean isMarkerClass(Expression scope) {
        if (scope instanceof NameExpr name) {
            return name.getNameAsString().equals(config.markerClass());
        }
        return scope instanceof FieldAccessExpr qualified
                && qualified.getNameAsString().equals(config.markerClass());
    }

    /**
     * The line of the method name, which for a chained marker is the line
     * holding {@code .dbg()} rather than the start of the chain.
     */
    private Optional<Integer> lineOf(MethodCallExpr call) {
        return call.getName().getBegin()
                .or(call::getBegin)
                .map((Position p) -> p.line);
    }
}
