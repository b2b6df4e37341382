package com.raditha.dbg.instrumentation;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.raditha.dbg.config.InstrumentationConfig;
import com.raditha.dbg.model.BuildMode;
import com.raditha.dbg.model.InspectCall;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InstrumentationTransformer.
 */
class InstrumentationTransformerTest {

    private static final InstrumentationConfig DEVELOPMENT = InstrumentationConfig.defaults();

    private InspectCall marker(String code, Path file) {
        CompilationUnit cu = StaticJavaParser.parse(code);
        InspectCallMatcher matcher = new InspectCallMatcher(DEVELOPMENT);
        return cu.findAll(MethodCallExpr.class).stream()
                .map(call -> matcher.match(call, file))
                .flatMap(java.util.Optional::stream)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testTraceCallShape() {
        InspectCall call = marker("""
                class T {
                    int m(int x, int y) {
                        return Dbg.inspect(x + y, true);
                    }
                }
                """, Path.of("/work/src/T.java"));

        Expression replacement = new InstrumentationTransformer(DEVELOPMENT).instrument(call);

        MethodCallExpr trace = assertInstanceOf(MethodCallExpr.class, replacement);
        assertEquals("com.raditha.dbg.runtime.Dbg", trace.getScope().orElseThrow().toString());
        assertEquals("trace", trace.getNameAsString());
        assertSame(call.target(), trace.getArgument(0));
        assertEquals(Path.of("/work/src/T.java").toString(), ((StringLiteralExpr) trace.getArgument(1)).asString());
        assertEquals("3", trace.getArgument(2).toString());
        assertEquals("  x + y", ((StringLiteralExpr) trace.getArgument(3)).asString());
        assertEquals("com.raditha.dbg.runtime.Dbg.var(\"x\", x)", trace.getArgument(4).toString());
        assertEquals("com.raditha.dbg.runtime.Dbg.var(\"y\", y)", trace.getArgument(5).toString());
        assertEquals(6, trace.getArguments().size());
    }

    @Test
    void testVariablesOnlyWhenRequested() {
        InspectCall call = marker("class T { int m(int x) { return Dbg.inspect(x * 2); } }", null);

        MethodCallExpr trace = (MethodCallExpr) new InstrumentationTransformer(DEVELOPMENT).instrument(call);

        assertEquals(4, trace.getArguments().size());
        assertEquals(InstrumentationTransformer.NO_FILE, ((StringLiteralExpr) trace.getArgument(1)).asString());
    }

    @Test
    void testProductionReturnsTargetItself() {
        InspectCall call = marker("class T { int m(int x) { return Dbg.inspect(x * 2, true); } }", null);
        InstrumentationTransformer transformer = new InstrumentationTransformer(DEVELOPMENT.withMode(BuildMode.PRODUCTION));

        assertSame(call.target(), transformer.instrument(call));
    }

    @Test
    void testTestModeStillTraces() {
        InspectCall call = marker("class T { int m(int x) { return Dbg.inspect(x); } }", null);
        InstrumentationTransformer transformer = new InstrumentationTransformer(DEVELOPMENT.withMode(BuildMode.TEST));

        MethodCallExpr trace = assertInstanceOf(MethodCallExpr.class, transformer.instrument(call));
        assertEquals("trace", trace.getNameAsString());
    }

    @Test
    void testLongExpressionsAreRendered() {
        InspectCall call = marker("""
                class T {
                    Object m() {
                        return Dbg.inspect(values.stream().filter(value -> value > threshold).map(value -> value * factor).toList());
                    }
                }
                """, null);

        String text = new InstrumentationTransformer(DEVELOPMENT).expressionText(call);

        assertTrue(text.startsWith("  values\n"), text);
        assertTrue(text.contains("\n    .filter(value -> value > threshold)\n"), text);
    }

    @Test
    void testRepeatedInstrumentationIsStable() {
        InspectCall call = marker("class T { int m(int a, int b) { return Dbg.inspect(Math.max(a, b), true); } }", null);
        InstrumentationTransformer transformer = new InstrumentationTransformer(DEVELOPMENT);

        String first = transformer.instrument(call).toString();
        String second = transformer.instrument(call).toString();

        assertEquals(first, second);
        assertTrue(first.endsWith("com.raditha.dbg.runtime.Dbg.var(\"a\", a), com.raditha.dbg.runtime.Dbg.var(\"b\", b))"),
                first);
    }
}
