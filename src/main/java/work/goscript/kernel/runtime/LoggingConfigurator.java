package work.goscript.kernel.runtime;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.goscript.kernel.api.LogLevel;

/**
 * Applies the configured log thresholds to Logback at runtime.
 */
public final class LoggingConfigurator {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {}

    public static void configure(KernelConfig config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.debug("Logback is not the active SLF4J backend, leaving log levels untouched");
            return;
        }
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(toLevel(config.logLevel()));
        for (Map.Entry<String, LogLevel> entry : config.loggerLevels().entrySet()) {
            context.getLogger(entry.getKey()).setLevel(toLevel(entry.getValue()));
        }
        LOG.debug("log level set to {} with {} logger overrides", config.logLevel(), config.loggerLevels().size());
    }

    static Level toLevel(LogLevel level) {
        return switch (level) {
            case TRACE -> Level.TRACE;
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR, FATAL -> Level.ERROR;
        };
    }
}
