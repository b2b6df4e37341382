package com.raditha.dbg.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.dbg.model.BuildMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads preprocessing settings from {@code dbg.yml} with overrides.
 * <p>
 * Configuration priority for the build mode: CLI argument &gt; system property
 * {@code dbg.mode} &gt; environment variable {@code DBG_MODE} &gt; dbg.yml &gt;
 * development. The other keys come from dbg.yml or their defaults:
 *
 * <pre>
 * dbg:
 *   mode: development
 *   marker_class: Dbg
 *   marker_method: inspect
 *   chain_method: dbg
 *   line_width: 60
 *   include_tests: true
 *   exclude_patterns:
 *     - "**&#47;generated/**"
 * </pre>
 */
public class DbgSettings {

    private static final Logger logger = LoggerFactory.getLogger(DbgSettings.class);

    public static final String DEFAULT_CONFIG_FILE = "dbg.yml";
    public static final String MODE_PROPERTY = "dbg.mode";
    public static final String MODE_ENV = "DBG_MODE";

    private static final String CONFIG_KEY = "dbg";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DbgSettings() {
        /* this is only a utility class */
    }

    /**
     * Load settings from an explicit file, or from {@code dbg.yml} in the
     * working directory when present.
     *
     * @param configFile Config file, null to look for the default one
     * @param modeCLI    Mode given on the command line, null when absent
     * @return Complete settings
     * @throws ConfigLoadException if the file is missing or is not valid YAML
     */
    public static InstrumentationConfig load(Path configFile, String modeCLI) {
        return load(configFile, modeCLI, System::getProperty, System::getenv);
    }

    /**
     * Load settings with explicit lookups for system properties and environment.
     */
    public static InstrumentationConfig load(Path configFile, String modeCLI,
            Function<String, String> properties, Function<String, String> environment) {
        Map<String, Object> config = readConfig(configFile);

        String mode = firstNonBlank(
                modeCLI,
                properties.apply(MODE_PROPERTY),
                environment.apply(MODE_ENV),
                getString(config, "mode", null));

        InstrumentationConfig settings = new InstrumentationConfig(
                BuildMode.fromString(mode),
                getString(config, "marker_class", InstrumentationConfig.DEFAULT_MARKER_CLASS),
                getString(config, "marker_method", InstrumentationConfig.DEFAULT_MARKER_METHOD),
                getString(config, "chain_method", InstrumentationConfig.DEFAULT_CHAIN_METHOD),
                getInt(config, "line_width", InstrumentationConfig.DEFAULT_LINE_WIDTH),
                getBoolean(config, "include_tests", true),
                getListString(config, "exclude_patterns"));

        logger.debug("Resolved settings: {}", settings);
        return settings;
    }

    private static Map<String, Object> readConfig(Path configFile) {
        Path file = configFile;
        if (file == null) {
            Path fallback = Path.of(DEFAULT_CONFIG_FILE);
            if (!Files.exists(fallback)) {
                return Map.of();
            }
            file = fallback;
        } else if (!Files.exists(file)) {
            throw new ConfigLoadException("Config file not found: " + file);
        }

        Object root;
        try {
            String content = Files.readString(file);
            root = content.isBlank() ? null : YAML_MAPPER.readValue(content, Object.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Could not read config file " + file + ": " + e.getMessage(), e);
        }

        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map<?, ?> rootMap)) {
            throw new ConfigLoadException("Config file " + file + " must contain a mapping");
        }
        Object section = rootMap.get(CONFIG_KEY);
        if (section == null) {
            return Map.of();
        }
        if (!(section instanceof Map)) {
            throw new ConfigLoadException("'" + CONFIG_KEY + "' in " + file + " must be a mapping");
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        return config;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return List.of();
    }
}
