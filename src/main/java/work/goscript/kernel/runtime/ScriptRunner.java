package work.goscript.kernel.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.goscript.kernel.value.ArrayValue;
import work.goscript.kernel.value.StructValue;

/**
 * Interprets script steps sequentially. Each step is {@code {call, in, out}}; input strings of the form
 * {@code $.name} (optionally followed by field names or array indices) read the current state.
 */
public final class ScriptRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

    private ScriptRunner() {}

    /**
     * Declares the script's types in {@code ctx} and runs its steps from an empty state.
     */
    public static Map<String, Object> run(ExecutionContext ctx, Script script) throws Exception {
        for (var entry : script.types().entrySet()) {
            ctx.types().declare(entry.getKey(), entry.getValue());
            LOG.debug("declared type {} = {}", entry.getKey(), entry.getValue());
        }
        return runSteps(ctx, script.steps(), new LinkedHashMap<>());
    }

    public static Map<String, Object> runSteps(ExecutionContext ctx, List<Map<String, Object>> rawSteps, Map<String, Object> initialState) throws Exception {
        var state = initialState == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(initialState);
        var steps = rawSteps == null ? List.<Map<String, Object>>of() : rawSteps;

        for (int index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            if (step == null) continue;
            var callId = Objects.toString(step.get("call"), null);
            var input = buildInput(castMap(step.get("in")), state);
            Object result;
            try {
                result = ctx.call(callId, input);
            } catch (Exception ex) {
                LOG.debug("step {} ({}) failed: {}", index, callId, ex.getMessage());
                throw ex;
            }
            applyOutputs(step, state, result);
        }
        return state;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object obj) {
        if (obj instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static Map<String, Object> buildInput(Map<String, Object> bindings, Map<String, Object> state) {
        var result = new LinkedHashMap<String, Object>();
        for (var entry : bindings.entrySet()) {
            result.put(entry.getKey(), resolveValue(entry.getValue(), state));
        }
        return result;
    }

    private static Object resolveValue(Object value, Map<String, Object> state) {
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(resolveValue(item, state));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue(), state));
            }
            return copy;
        }
        if (value instanceof String str && str.startsWith("$.")) {
            return getByPath(state, str);
        }
        return value;
    }

    private static Object getByPath(Map<String, Object> state, String path) {
        var parts = path.split("\\.");
        if (parts.length < 2 || !state.containsKey(parts[1])) {
            throw new IllegalStateException("Unknown state reference: " + path);
        }
        Object current = state.get(parts[1]);
        for (int i = 2; i < parts.length; i++) {
            String part = parts[i];
            if (current instanceof StructValue struct) {
                current = struct.get(part);
            } else if (current instanceof ArrayValue array) {
                int position = parseIndex(part);
                if (position < 0) {
                    throw new IllegalStateException("Invalid array index '" + part + "' in " + path);
                }
                current = array.get(position);
            } else if (current instanceof Map<?, ?> map) {
                current = map.get(part);
            } else {
                throw new IllegalStateException("Cannot select '" + part + "' in " + path);
            }
        }
        return current;
    }

    private static int parseIndex(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static void applyOutputs(Map<String, Object> step, Map<String, Object> state, Object result) {
        var outs = castMap(step.get("out"));
        for (var entry : outs.entrySet()) {
            var alias = entry.getValue();
            Object resolved;
            if ("$".equals(alias)) {
                resolved = result;
            } else if (alias instanceof String key && result instanceof Map<?, ?> resMap) {
                resolved = resMap.get(key);
            } else {
                resolved = null;
            }
            state.put(entry.getKey(), resolved);
        }
    }
}
