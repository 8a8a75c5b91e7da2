package work.goscript.kernel.api;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class ScriptFixturesTest {
    @Test
    void everyFixturePasses() throws Exception {
        List<Path> fixtures;
        try (var files = Files.list(Path.of("src", "test", "resources", "scripts"))) {
            fixtures = files.filter(path -> path.toString().endsWith(".yaml")).sorted().collect(Collectors.toList());
        }
        assertFalse(fixtures.isEmpty());

        var runner = new GosRunner();
        for (Path fixture : fixtures) {
            var result = runner.run(RunConfiguration.builder().script(fixture).build());
            assertTrue(result.isSuccess(), () -> fixture.getFileName() + ": " + result.toPrettyJson());
        }
    }
}
