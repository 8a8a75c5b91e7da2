package work.goscript.kernel.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration passed to {@link GosRunner} when running a script.
 *
 * @param script script file (YAML or JSON)
 * @param configFile optional TOML file overriding the bundled configuration
 * @param logLevel optional log threshold overriding the configured one
 */
public record RunConfiguration(Path script, Optional<Path> configFile, Optional<LogLevel> logLevel) {
    public RunConfiguration {
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path script;
        private Optional<Path> configFile = Optional.empty();
        private Optional<LogLevel> logLevel = Optional.empty();

        public Builder script(Path script) {
            this.script = script;
            return this;
        }

        public Builder configFile(Path configFile) {
            this.configFile = Optional.ofNullable(configFile);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = Optional.ofNullable(logLevel);
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(script, configFile, logLevel);
        }
    }
}
