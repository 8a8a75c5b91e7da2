package work.goscript.kernel.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunCommandTest {
    private static final Path SCRIPTS = Path.of("src", "test", "resources", "scripts");

    @TempDir
    Path tempDir;

    @Test
    void passingScriptsExitWithZero() {
        int exitCode = Main.execute(
            "-s", SCRIPTS.resolve("struct_literals.yaml").toString(),
            SCRIPTS.resolve("nil_map.yaml").toString(),
            "--log-level", "error");
        assertEquals(0, exitCode);
    }

    @Test
    void failingScriptSetsExitCode() throws Exception {
        var script = tempDir.resolve("bad.yaml");
        Files.writeString(script, """
            steps:
              - call: gos://value/zero@1
                in: { type: int }
                out: { z: value }
            expect:
              z: "1"
            """);

        assertEquals(1, Main.execute("-s", SCRIPTS.resolve("nil_map.yaml").toString(), script.toString()));
    }

    @Test
    void missingConfigFileIsAUsageError() {
        int exitCode = Main.execute(
            "-s", SCRIPTS.resolve("nil_map.yaml").toString(),
            "--config", tempDir.resolve("missing.toml").toString());
        assertEquals(2, exitCode);
    }

    @Test
    void unknownLogLevelFails() {
        assertEquals(1, Main.execute("-s", SCRIPTS.resolve("nil_map.yaml").toString(), "--log-level", "loud"));
    }

    @Test
    void scriptOptionIsRequired() {
        assertEquals(2, Main.execute());
    }
}
