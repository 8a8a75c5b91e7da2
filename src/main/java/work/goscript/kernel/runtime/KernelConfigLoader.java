package work.goscript.kernel.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.goscript.kernel.api.LogLevel;

/**
 * Reads {@link KernelConfig} from the bundled {@code goscript-kernel.toml}, optionally overridden by a user file.
 *
 * <pre>
 * [literal]
 * max-length = 1048576
 *
 * [logging]
 * level = "warn"
 *
 * [logging.levels]
 * "work.goscript.kernel.heap" = "debug"
 * </pre>
 */
public final class KernelConfigLoader {
    public static final String DEFAULT_RESOURCE = "goscript-kernel.toml";

    private static final Logger LOG = LoggerFactory.getLogger(KernelConfigLoader.class);
    private static final String MAX_LENGTH_KEY = "literal.max-length";
    private static final String LEVEL_KEY = "logging.level";
    private static final String LEVELS_KEY = "logging.levels";

    private KernelConfigLoader() {}

    public static KernelConfig loadDefaults() {
        return load(null);
    }

    /**
     * Loads the bundled defaults and applies {@code override} on top when it is not {@code null}.
     */
    public static KernelConfig load(Path override) {
        var config = KernelConfig.defaults();
        var bundled = readResource(DEFAULT_RESOURCE);
        if (bundled != null) {
            config = apply(config, parse(bundled, "classpath:" + DEFAULT_RESOURCE));
        }
        if (override != null) {
            String text;
            try {
                text = Files.readString(override, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read config: " + override, ex);
            }
            config = apply(config, parse(text, override.toString()));
            LOG.debug("loaded configuration override {}", override);
        }
        return config;
    }

    public static KernelConfig parse(String toml) {
        return apply(KernelConfig.defaults(), parse(toml, "<inline>"));
    }

    private static KernelConfig apply(KernelConfig base, TomlParseResult toml) {
        long maxLength = base.maxLiteralLength();
        if (toml.contains(MAX_LENGTH_KEY)) {
            if (!toml.isLong(MAX_LENGTH_KEY)) {
                throw new IllegalArgumentException(MAX_LENGTH_KEY + " must be an integer");
            }
            maxLength = toml.getLong(MAX_LENGTH_KEY);
        }
        var level = base.logLevel();
        if (toml.contains(LEVEL_KEY)) {
            if (!toml.isString(LEVEL_KEY)) {
                throw new IllegalArgumentException(LEVEL_KEY + " must be a string");
            }
            level = LogLevel.from(toml.getString(LEVEL_KEY));
        }
        var levels = new LinkedHashMap<>(base.loggerLevels());
        levels.putAll(readLevels(toml.getTable(LEVELS_KEY)));
        return new KernelConfig(maxLength, level, levels);
    }

    private static Map<String, LogLevel> readLevels(TomlTable table) {
        var levels = new LinkedHashMap<String, LogLevel>();
        if (table == null || table.isEmpty()) {
            return levels;
        }
        for (String name : table.keySet()) {
            var raw = table.get(List.of(name));
            if (!(raw instanceof String text)) {
                throw new IllegalArgumentException(LEVELS_KEY + "." + name + " must be a string");
            }
            levels.put(name, LogLevel.from(text));
        }
        return levels;
    }

    private static TomlParseResult parse(String text, String origin) {
        var result = Toml.parse(text);
        if (result.hasErrors()) {
            var details = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + details);
        }
        return result;
    }

    private static String readResource(String name) {
        var loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = KernelConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                return null;
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read classpath resource " + name, ex);
        }
    }
}
