package work.goscript.kernel.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.goscript.kernel.runtime.ExecutionContext;
import work.goscript.kernel.runtime.KernelConfig;
import work.goscript.kernel.runtime.KernelConfigLoader;
import work.goscript.kernel.runtime.KernelRegistry;
import work.goscript.kernel.runtime.LoggingConfigurator;
import work.goscript.kernel.runtime.Script;
import work.goscript.kernel.runtime.ScriptLoader;
import work.goscript.kernel.runtime.ScriptRunner;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.ValueFormatter;

/**
 * Public entry point for embedding the kernel: loads a script, runs it and checks its expectations.
 */
public final class GosRunner {
    public static final String DEBUG_PROPERTY = "goscript.debug";

    private static final Logger LOG = LoggerFactory.getLogger(GosRunner.class);

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var source = configuration.script().toString();
        try {
            var config = KernelConfigLoader.load(configuration.configFile().orElse(null))
                .withLogLevel(configuration.logLevel().orElse(null));
            LoggingConfigurator.configure(config);
            var script = ScriptLoader.loadFromLocalFile(configuration.script());
            return execute(script, config, started);
        } catch (Exception ex) {
            return failed(source, ex, started);
        }
    }

    /**
     * Runs an already loaded script with the given configuration.
     */
    public RunResult run(Script script, KernelConfig config) {
        var started = Instant.now();
        try {
            return execute(script, config, started);
        } catch (Exception ex) {
            return failed(script.source(), ex, started);
        }
    }

    private RunResult execute(Script script, KernelConfig config, Instant started) throws Exception {
        var ctx = new ExecutionContext(KernelRegistry.create(), config);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("script", script.source());
        Map<String, Object> finalState;
        try {
            finalState = ScriptRunner.run(ctx, script);
        } catch (KernelPanicException panic) {
            metadata.put("panic", panicInfo(panic));
            if (script.expectsPanic() && matches(panic, script.expectedPanic())) {
                metadata.put("status", "ok");
                return RunResult.success(metadata, started);
            }
            LOG.warn("script {} panicked: {}", script.source(), panic.getMessage());
            return RunResult.failure("panic: " + panic.getMessage(), metadata, started);
        }
        metadata.put("result", formatState(finalState));
        if (script.expectsPanic()) {
            return RunResult.failure("expected panic '" + script.expectedPanic() + "' but the script completed",
                metadata, started);
        }
        var mismatches = checkExpectations(script.expect(), finalState);
        if (!mismatches.isEmpty()) {
            metadata.put("mismatches", mismatches);
            return RunResult.failure(mismatches.size() + " expectation(s) not met", metadata, started);
        }
        metadata.put("status", "ok");
        return RunResult.success(metadata, started);
    }

    private RunResult failed(String source, Exception ex, Instant started) {
        var errorMeta = new LinkedHashMap<String, Object>();
        errorMeta.put("script", source);
        if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
            errorMeta.put("error", ex.getMessage());
        }
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            LOG.error("script {} failed", source, ex);
        }
        var message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return RunResult.failure(message, errorMeta, started);
    }

    private static boolean matches(KernelPanicException panic, String expected) {
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return panic.code().id().equals(expected) || panic.getMessage().contains(expected);
    }

    private static Map<String, Object> panicInfo(KernelPanicException panic) {
        var info = new LinkedHashMap<String, Object>();
        info.put("code", panic.code().id());
        info.put("message", panic.getMessage());
        return info;
    }

    private static List<Map<String, Object>> checkExpectations(Map<String, Object> expect, Map<String, Object> state) {
        var mismatches = new ArrayList<Map<String, Object>>();
        for (var entry : expect.entrySet()) {
            if (Script.PANIC_KEY.equals(entry.getKey())) continue;
            var expected = entry.getValue() == null ? "<nil>" : String.valueOf(entry.getValue());
            String actual = state.containsKey(entry.getKey()) ? render(state.get(entry.getKey())) : null;
            if (!expected.equals(actual)) {
                var mismatch = new LinkedHashMap<String, Object>();
                mismatch.put("name", entry.getKey());
                mismatch.put("expected", expected);
                mismatch.put("actual", actual);
                mismatches.add(mismatch);
            }
        }
        return mismatches;
    }

    static Map<String, Object> formatState(Map<String, Object> state) {
        var formatted = new LinkedHashMap<String, Object>();
        for (var entry : state.entrySet()) {
            formatted.put(entry.getKey(), render(entry.getValue()));
        }
        return formatted;
    }

    private static String render(Object value) {
        if (value instanceof RuntimeValue runtime) {
            return ValueFormatter.format(runtime);
        }
        return value == null ? "<nil>" : String.valueOf(value);
    }
}
