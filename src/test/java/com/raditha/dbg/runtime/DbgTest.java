package com.raditha.dbg.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the runtime entry points used by generated code.
 */
class DbgTest {

    private static final String CWD = "/work";

    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        Dbg.setEmitter(new TraceEmitter(() -> out, () -> CWD));
    }

    @AfterEach
    void tearDown() {
        Dbg.setEmitter(null);
        Dbg.setValueRenderer(null);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testInspectIsPassThrough() {
        Object value = new Object();

        assertSame(value, Dbg.inspect(value));
        assertSame(value, Dbg.inspect(value, true));
        assertEquals("", output());
    }

    @Test
    void testTraceReturnsResult() {
        int x = 7;

        Integer result = Dbg.trace(x, "/work/src/Calc.java", 3, "  x");

        assertEquals(7, result);
        assertEquals("\u001B[41m\u001B[1m\u001B[K\n./src/Calc.java:3\n  x #=> 7\u001B[K\n\u001B[0m\n", output());
    }

    @Test
    void testTraceWithVariables() {
        int x = 7;
        int y = 5;

        int result = Dbg.trace(x + y, "/work/src/Calc.java", 8, "  x + y", Dbg.var("x", x), Dbg.var("y", y));

        assertEquals(12, result);
        assertEquals("\u001B[41m\u001B[1m\u001B[K\n./src/Calc.java:8\n"
                + "  x = 7\u001B[K\n"
                + "  y = 5\u001B[K\n"
                + "  x + y #=> 12\u001B[K\n\u001B[0m\n", output());
    }

    @Test
    void testValuesAreRenderedForInspection() {
        Map<String, Integer> counts = Map.of("a", 1);

        Dbg.trace(counts, "/work/Main.java", 2, "  counts", Dbg.var("name", "bob"));

        assertTrue(output().contains("  name = \"bob\"\u001B[K\n"));
        assertTrue(output().contains("  counts #=> {\"a\"=1}\u001B[K\n"));
    }

    @Test
    void testNullResult() {
        String nothing = null;

        assertNull(Dbg.trace(nothing, "/work/Main.java", 2, "  nothing"));
        assertTrue(output().contains("  nothing #=> null"));
    }

    @Test
    void testCustomValueRenderer() {
        Dbg.setValueRenderer(value -> "<" + value + ">");

        Dbg.trace(List.of(1, 2), "/work/Main.java", 2, "  list");

        assertTrue(output().contains("  list #=> <[1, 2]>"));
    }
}
