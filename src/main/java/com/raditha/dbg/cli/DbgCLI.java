package com.raditha.dbg.cli;

import com.raditha.dbg.config.ConfigLoadException;
import com.raditha.dbg.config.DbgSettings;
import com.raditha.dbg.config.InstrumentationConfig;
import com.raditha.dbg.instrumentation.DiffGenerator;
import com.raditha.dbg.instrumentation.InstrumentationException;
import com.raditha.dbg.instrumentation.InstrumentationResult;
import com.raditha.dbg.instrumentation.SourceInstrumenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Command-line entry point of the preprocessor.
 * <p>
 * Usage:
 * java -jar dbg-inspect.jar [options] &lt;source-root&gt;...
 * <p>
 * Configuration priority: CLI arguments &gt; dbg.mode / DBG_MODE &gt; dbg.yml &gt; defaults
 */
@Command(name = "dbg-inspect", mixinStandardHelpOptions = true, version = "dbg-inspect v1.0.0",
        description = "Rewrites Dbg.inspect(..) and .dbg() markers into tracing code, or strips them for production")
@SuppressWarnings("java:S106")
public class DbgCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(DbgCLI.class);

    @Parameters(paramLabel = "<source-root>", arity = "1..*", description = "Java files or directories to rewrite")
    private List<Path> sourceRoots = new ArrayList<>();

    @Option(names = "--mode", description = "Build mode: development, test or production", paramLabel = "<mode>")
    private String mode;

    @Option(names = "--config-file", description = "Use custom configuration file (default: ./dbg.yml)", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--output", description = "Directory for rewritten sources (default: rewrite in place)", paramLabel = "<path>")
    private Path outputPath;

    @Option(names = "--dry-run", description = "Print unified diffs instead of writing files")
    private boolean dryRun = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws IOException {
        validateConfiguration();

        InstrumentationConfig config = DbgSettings.load(configFile, mode);
        SourceInstrumenter instrumenter = new SourceInstrumenter(config);
        DiffGenerator diffGenerator = new DiffGenerator();

        int files = 0;
        int sites = 0;
        for (Path root : sourceRoots) {
            for (Path source : javaFiles(root)) {
                if (config.shouldExclude(source.toAbsolutePath().toString())) {
                    logger.debug("Excluded {}", source);
                    if (!dryRun && outputPath != null) {
                        copyUnchanged(source, targetFor(root, source));
                    }
                    continue;
                }
                InstrumentationResult result;
                if (dryRun) {
                    result = instrumenter.instrument(source);
                    if (result.isModified()) {
                        System.out.println(diffGenerator.generateUnifiedDiff(result));
                    }
                } else {
                    result = instrumenter.instrument(source, targetFor(root, source));
                }
                if (result.isModified()) {
                    files++;
                    sites += result.sites();
                    logger.info("Rewrote {} call site(s) in {}", result.sites(), source);
                }
            }
        }

        System.out.printf("%s %d call site(s) in %d file(s) (mode: %s)%n",
                dryRun ? "Would rewrite" : "Rewrote", sites, files, config.mode().name().toLowerCase());
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Command line with the exit code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new DbgCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException || ex instanceof ConfigLoadException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InstrumentationException) {
                commandLine.getErr().println("Instrumentation error: " + ex.getMessage());
                return 1;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        for (Path root : sourceRoots) {
            if (!Files.exists(root)) {
                throw new IllegalArgumentException("Source path not found: " + root);
            }
        }

        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    private List<Path> javaFiles(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".java"))
                    .sorted()
                    .toList();
        }
    }

    private void copyUnchanged(Path source, Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private Path targetFor(Path root, Path source) {
        if (outputPath == null) {
            return source;
        }
        Path relative = Files.isRegularFile(root) ? source.getFileName() : root.relativize(source);
        return outputPath.resolve(relative);
    }
}
