package com.raditha.dbg.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command line: rewriting, dry runs and exit codes.
 */
class DbgCLITest {

    private static final String CALC = """
            package demo;

            class Calc {
                int sum(int x, int y) {
                    return Dbg.inspect(x + y, true);
                }
            }
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private Path sources;
    private Path calc;

    @BeforeEach
    void setUp() throws IOException {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));

        sources = tempDir.resolve("src");
        calc = sources.resolve("demo/Calc.java");
        Files.createDirectories(calc.getParent());
        Files.writeString(calc, CALC);
        Files.writeString(sources.resolve("demo/Plain.java"), "package demo;\n\nclass Plain {\n}\n");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        CommandLine cmd = DbgCLI.createCommandLine();
        return cmd.execute(args);
    }

    @Test
    void testRewritesInPlace() throws IOException {
        int exitCode = run("--mode", "production", sources.toString());

        assertEquals(0, exitCode, errContent.toString());
        String rewritten = Files.readString(calc);
        assertTrue(rewritten.contains("return x + y;"), rewritten);
        assertTrue(outContent.toString().contains("Rewrote 1 call site(s) in 1 file(s) (mode: production)"),
                outContent.toString());
    }

    @Test
    void testDevelopmentMode() throws IOException {
        int exitCode = run("--mode", "development", calc.toString());

        assertEquals(0, exitCode, errContent.toString());
        assertTrue(Files.readString(calc).contains("com.raditha.dbg.runtime.Dbg.trace(x + y"));
    }

    @Test
    void testDryRunLeavesFilesAlone() throws IOException {
        int exitCode = run("--mode", "production", "--dry-run", sources.toString());

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(CALC, Files.readString(calc));
        String output = outContent.toString();
        assertTrue(output.contains("--- a/Calc.java"), output);
        assertTrue(output.contains("+        return x + y;"), output);
        assertTrue(output.contains("Would rewrite 1 call site(s) in 1 file(s)"), output);
    }

    @Test
    void testOutputDirectory() throws IOException {
        Path out = tempDir.resolve("out");

        int exitCode = run("--mode", "production", "--output", out.toString(), sources.toString());

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(CALC, Files.readString(calc));
        assertTrue(Files.readString(out.resolve("demo/Calc.java")).contains("return x + y;"));
        assertTrue(Files.exists(out.resolve("demo/Plain.java")));
    }

    @Test
    void testConfigFile() throws IOException {
        Path config = tempDir.resolve("custom.yml");
        Files.writeString(config, "dbg:\n  mode: production\n  exclude_patterns:\n    - \"**/Calc.java\"\n");

        int exitCode = run("--config-file", config.toString(), sources.toString());

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(CALC, Files.readString(calc));
        assertTrue(outContent.toString().contains("Rewrote 0 call site(s) in 0 file(s)"), outContent.toString());
    }

    @Test
    void testExcludedFilesAreCopiedToOutput() throws IOException {
        Path config = tempDir.resolve("custom.yml");
        Files.writeString(config, "dbg:\n  mode: production\n  exclude_patterns:\n    - \"**/Calc.java\"\n");
        Path out = tempDir.resolve("out");

        int exitCode = run("--config-file", config.toString(), "--output", out.toString(), sources.toString());

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(CALC, Files.readString(out.resolve("demo/Calc.java")));
        assertTrue(Files.exists(out.resolve("demo/Plain.java")));
    }

    @Test
    void testMissingSourcePath() {
        int exitCode = run(tempDir.resolve("nowhere").toString());

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Source path not found"), errContent.toString());
    }

    @Test
    void testMissingConfigFile() {
        int exitCode = run("--config-file", tempDir.resolve("absent.yml").toString(), sources.toString());

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Config file not found"), errContent.toString());
    }

    @Test
    void testOutputIsAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("taken"), "x");

        assertEquals(2, run("--output", file.toString(), sources.toString()));
    }

    @Test
    void testUnknownOption() {
        int exitCode = run("--no-such-option", sources.toString());

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Unknown option"), errContent.toString());
    }

    @Test
    void testNoSourceRoots() {
        assertEquals(2, run());
    }

    @Test
    void testUnparsableSource() throws IOException {
        Files.writeString(sources.resolve("demo/Broken.java"), "class Broken {");

        int exitCode = run("--dry-run", sources.toString());

        assertEquals(1, exitCode);
        assertTrue(errContent.toString().contains("Instrumentation error"), errContent.toString());
    }
}
