package com.raditha.dbg.instrumentation;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.raditha.dbg.config.InstrumentationConfig;
import com.raditha.dbg.model.InspectCall;
import com.raditha.dbg.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites every instrumenting call of a compilation unit.
 * <p>
 * The unit is printed with JavaParser's lexical preserving printer, so code
 * around the call sites keeps its formatting and line numbers.
 */
public class SourceInstrumenter {

    private static final Logger logger = LoggerFactory.getLogger(SourceInstrumenter.class);

    private static final String PASS_THROUGH_METHOD = "inspect";
    private static final Set<UnaryExpr.Operator> STATEMENT_OPERATORS = EnumSet.of(
            UnaryExpr.Operator.PREFIX_INCREMENT,
            UnaryExpr.Operator.PREFIX_DECREMENT,
            UnaryExpr.Operator.POSTFIX_INCREMENT,
            UnaryExpr.Operator.POSTFIX_DECREMENT);

    private final InspectCallMatcher matcher;
    private final InstrumentationTransformer transformer;
    private final JavaParser parser;

    public SourceInstrumenter(InstrumentationConfig config) {
        this(new InspectCallMatcher(config), new InstrumentationTransformer(config));
    }

    public SourceInstrumenter(InspectCallMatcher matcher, InstrumentationTransformer transformer) {
        this.matcher = matcher;
        this.transformer = transformer;
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    /**
     * Parse and rewrite a source file. The file itself is not modified.
     *
     * @param file Java source file
     * @return The rewritten source
     * @throws IOException            if the file cannot be read
     * @throws InstrumentationException if the file does not parse
     */
    public InstrumentationResult instrument(Path file) throws IOException {
        ParseResult<CompilationUnit> parsed = parser.parse(file);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw new InstrumentationException("Cannot parse " + file + ": " + parsed.getProblems());
        }
        return instrument(parsed.getResult().get());
    }

    /**
     * Parse and rewrite source text that has no backing file.
     */
    public InstrumentationResult instrument(String code) {
        ParseResult<CompilationUnit> parsed = parser.parse(code);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw new InstrumentationException("Cannot parse source: " + parsed.getProblems());
        }
        return instrument(parsed.getResult().get());
    }

    /**
     * Rewrite a parsed compilation unit in place.
     *
     * @param cu Unit to rewrite; must still carry its tokens
     * @return The rewritten source
     */
    public InstrumentationResult instrument(CompilationUnit cu) {
        Path file = ASTUtility.getSourcePath(cu).orElse(null);
        LexicalPreservingPrinter.setup(cu);
        String original = LexicalPreservingPrinter.print(cu);
        MarkerVisitor visitor = new MarkerVisitor(file);
        cu.accept(visitor, null);

        if (visitor.sites == 0) {
            return new InstrumentationResult(file, original, original, 0);
        }
        logger.debug("Rewrote {} call site(s) in {}", visitor.sites, file == null ? "<source>" : file);
        return new InstrumentationResult(file, original, LexicalPreservingPrinter.print(cu), visitor.sites);
    }

    /**
     * Rewrite a file and write the result.
     *
     * @param source Java source file
     * @param target Where to write the rewritten source; may equal {@code source}
     * @return The rewritten source
     * @throws IOException if reading or writing fails
     */
    public InstrumentationResult instrument(Path source, Path target) throws IOException {
        InstrumentationResult result = instrument(source);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, result.rewrittenCode());
        return result;
    }

    /**
     * A statement cannot consist of an arbitrary expression. When a stripped
     * marker stood alone as a statement, keep the pass-through runtime call
     * around its target.
     */
    private Optional<MethodCallExpr> passThroughFor(InspectCall call, Expression replacement) {
        boolean standalone = call.call().getParentNode()
                .filter(ExpressionStmt.class::isInstance)
                .isPresent();
        if (!standalone || replacement != call.target() || isStatementExpression(replacement)) {
            return Optional.empty();
        }
        logger.debug("Keeping a pass-through call for the standalone marker at {}", call.site());
        return Optional.of(new MethodCallExpr(
                StaticJavaParser.parseExpression(InstrumentationTransformer.RUNTIME_CLASS),
                PASS_THROUGH_METHOD,
                new NodeList<>(replacement)));
    }

    /**
     * A stripped target takes the place of a call, which binds tighter than
     * any operator. Operands and receivers keep their grouping with
     * parentheses; argument lists and other delimited slots need none.
     */
    private static boolean needsParentheses(InspectCall call, Expression replacement) {
        if (replacement != call.target() || !isOperatorExpression(replacement)) {
            return false;
        }
        Optional<Node> parent = call.call().getParentNode();
        if (parent.isEmpty() || !(parent.get() instanceof Expression)) {
            return false;
        }
        Node p = parent.get();
        if (p instanceof EnclosedExpr || p instanceof ArrayInitializerExpr) {
            return false;
        }
        if (p instanceof MethodCallExpr outer) {
            return outer.getArguments().stream().noneMatch(a -> a == call.call());
        }
        if (p instanceof ObjectCreationExpr creation) {
            return creation.getArguments().stream().noneMatch(a -> a == call.call());
        }
        if (p instanceof AssignExpr assign) {
            return assign.getValue() != call.call();
        }
        return true;
    }

    private static boolean isOperatorExpression(Expression expression) {
        return expression instanceof BinaryExpr
                || expression instanceof ConditionalExpr
                || expression instanceof AssignExpr
                || expression instanceof CastExpr
                || expression instanceof InstanceOfExpr
                || expression instanceof UnaryExpr
                || expression instanceof LambdaExpr
                || expression instanceof SwitchExpr;
    }

    private static boolean isStatementExpression(Expression expression) {
        if (expression instanceof UnaryExpr unary) {
            return STATEMENT_OPERATORS.contains(unary.getOperator());
        }
        return expression instanceof MethodCallExpr
                || expression instanceof AssignExpr
                || expression instanceof ObjectCreationExpr;
    }

    private class MarkerVisitor extends ModifierVisitor<Void> {
        private final Path file;
        private int sites;

        private MarkerVisitor(Path file) {
            this.file = file;
        }

        @Override
        public Visitable visit(MethodCallExpr n, Void arg) {
            Optional<InspectCall> call = matcher.match(n, file);
            if (call.isEmpty()) {
                return super.visit(n, arg);
            }
            sites++;
            Expression replacement = transformer.instrument(call.get());
            Optional<MethodCallExpr> passThrough = passThroughFor(call.get(), replacement);
            if (passThrough.isPresent()) {
                return super.visit(passThrough.get(), arg);
            }
            if (needsParentheses(call.get(), replacement)) {
                return new EnclosedExpr(replacement).accept(this, arg);
            }
            // markers nested in the target are handled once it is in place
            return replacement.accept(this, arg);
        }
    }
}
