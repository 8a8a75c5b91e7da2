package work.goscript.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GosRunnerTest {
    private static final Path SCRIPTS = Path.of("src", "test", "resources", "scripts");

    @TempDir
    Path tempDir;

    @Test
    void runsLocalScriptFile() {
        var config = RunConfiguration.builder()
            .script(SCRIPTS.resolve("struct_literals.yaml").toAbsolutePath())
            .logLevel(LogLevel.INFO)
            .build();

        var result = new GosRunner().run(config);
        assertEquals(RunResult.Status.SUCCESS, result.status(), () -> result.toPrettyJson());
        var state = (Map<?, ?>) result.metadata().get("result");
        assertEquals("{0 88 0}", state.get("keyed"));
        assertEquals("88", state.get("b"));
    }

    @Test
    void expectedPanicCountsAsSuccess() {
        var result = new GosRunner().run(RunConfiguration.builder()
            .script(SCRIPTS.resolve("nil_map_write.yaml"))
            .build());

        assertTrue(result.isSuccess(), () -> result.toPrettyJson());
        var panic = (Map<?, ?>) result.metadata().get("panic");
        assertEquals("assignment_to_nil_map", panic.get("code"));
    }

    @Test
    void unexpectedPanicFails() throws Exception {
        var script = write("""
            steps:
              - call: gos://map/nil@1
                in: { type: "map[string]int" }
                out: { m: value }
              - call: gos://map/set@1
                in: { map: $.m, key: a, value: 1 }
            """);

        var result = new GosRunner().run(RunConfiguration.builder().script(script).build());
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertTrue(String.valueOf(result.metadata().get("error")).contains("nil map"));
    }

    @Test
    void reportsExpectationMismatches() throws Exception {
        var script = write("""
            steps:
              - call: gos://literal/array@1
                in: { type: "[...]int", entries: [1, 2] }
                out: { a: value }
            expect:
              a: "[1 2 3]"
            """);

        var result = new GosRunner().run(RunConfiguration.builder().script(script).build());
        assertFalse(result.isSuccess());
        var mismatches = (List<?>) result.metadata().get("mismatches");
        assertEquals(1, mismatches.size());
        var mismatch = (Map<?, ?>) mismatches.get(0);
        assertEquals("[1 2]", mismatch.get("actual"));
    }

    @Test
    void panicExpectationFailsWhenScriptCompletes() throws Exception {
        var script = write("""
            steps:
              - call: gos://map/make@1
                in: { type: "map[string]int" }
                out: { m: value }
            expect:
              panic: assignment_to_nil_map
            """);

        var result = new GosRunner().run(RunConfiguration.builder().script(script).build());
        assertFalse(result.isSuccess());
        assertTrue(String.valueOf(result.metadata().get("error")).startsWith("expected panic"));
    }

    @Test
    void configFileLimitsLiteralLength() throws Exception {
        var script = write("""
            steps:
              - call: gos://literal/array@1
                in:
                  type: "[...]int"
                  entries:
                    - { $key: 20, value: 1 }
                out: { a: value }
            """);
        var config = Path.of("src", "test", "resources", "config", "small-literals.toml");

        var result = new GosRunner().run(RunConfiguration.builder().script(script).configFile(config).build());
        assertFalse(result.isSuccess());
        var panic = (Map<?, ?>) result.metadata().get("panic");
        assertEquals("literal_too_large", panic.get("code"));
    }

    @Test
    void missingScriptIsReportedAsFailure() {
        var result = new GosRunner().run(RunConfiguration.builder().script(tempDir.resolve("absent.yaml")).build());
        assertFalse(result.isSuccess());
        assertTrue(result.metadata().containsKey("error"));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    private Path write(String text) throws Exception {
        var file = Files.createTempFile(tempDir, "script", ".yaml");
        Files.writeString(file, text);
        return file;
    }
}
