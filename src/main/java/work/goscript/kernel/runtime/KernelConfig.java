package work.goscript.kernel.runtime;

import java.util.Map;
import java.util.Objects;
import work.goscript.kernel.api.LogLevel;
import work.goscript.kernel.literal.LiteralConstructor;

/**
 * Settings read from {@code goscript-kernel.toml}.
 *
 * @param maxLiteralLength upper bound on array literal lengths
 * @param logLevel threshold applied to the root logger
 * @param loggerLevels per-logger overrides keyed by logger name
 */
public record KernelConfig(long maxLiteralLength, LogLevel logLevel, Map<String, LogLevel> loggerLevels) {
    public KernelConfig {
        if (maxLiteralLength <= 0) {
            throw new IllegalArgumentException("literal.max-length must be positive: " + maxLiteralLength);
        }
        Objects.requireNonNull(logLevel, "logLevel");
        loggerLevels = loggerLevels == null ? Map.of() : Map.copyOf(loggerLevels);
    }

    public static KernelConfig defaults() {
        return new KernelConfig(LiteralConstructor.DEFAULT_MAX_LENGTH, LogLevel.WARN, Map.of());
    }

    public KernelConfig withLogLevel(LogLevel level) {
        return level == null ? this : new KernelConfig(maxLiteralLength, level, loggerLevels);
    }
}
