package work.goscript.kernel.runtime;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads scripts (YAML or JSON) into in-memory step maps. Floating point literals are kept as
 * {@link java.math.BigDecimal} so constants keep their exact decimal value.
 */
public final class ScriptLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ScriptLoader() {}

    public static Script loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            var script = parseScript(in, path.toString());
            LOG.debug("loaded script {} with {} steps", path, script.steps().size());
            return script;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read script: " + path, ex);
        }
    }

    public static Script parse(String text, String source) {
        try {
            return parseScript(YAML_MAPPER.readTree(text), source);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse script: " + source, ex);
        }
    }

    private static Script parseScript(InputStream in, String source) throws IOException {
        return parseScript(YAML_MAPPER.readTree(in), source);
    }

    private static Script parseScript(JsonNode root, String source) throws IOException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new Script(source, Map.of(), List.of(), Map.of());
        }
        if (!root.isObject()) {
            throw new IOException("Script must be an object: " + source);
        }
        return new Script(source, readTypes(root.get("types")), readSteps(root.get("steps")), readExpect(root.get("expect")));
    }

    private static Map<String, String> readTypes(JsonNode node) throws IOException {
        var types = new LinkedHashMap<String, String>();
        if (node == null || node.isNull()) {
            return types;
        }
        if (!node.isObject()) {
            throw new IOException("'types' must map type names to type expressions");
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (!entry.getValue().isTextual()) {
                throw new IOException("Type expression for " + entry.getKey() + " must be a string");
            }
            types.put(entry.getKey(), entry.getValue().asText());
        }
        return types;
    }

    private static List<Map<String, Object>> readSteps(JsonNode node) throws IOException {
        var steps = new ArrayList<Map<String, Object>>();
        if (node == null || node.isNull()) {
            return steps;
        }
        if (!node.isArray()) {
            throw new IOException("'steps' must be a list");
        }
        for (var stepNode : node) {
            steps.add(toMap(stepNode));
        }
        return steps;
    }

    private static Map<String, Object> readExpect(JsonNode node) throws IOException {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        return toMap(node);
    }

    private static Map<String, Object> toMap(JsonNode node) throws IOException {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IOException("Script step must be an object: " + node);
        }
        var map = new LinkedHashMap<String, Object>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), convertNode(entry.getValue()));
        }
        return map;
    }

    private static Object convertNode(JsonNode node) throws IOException {
        if (node.isObject()) {
            return toMap(node);
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
