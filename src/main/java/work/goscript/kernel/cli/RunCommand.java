package work.goscript.kernel.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.goscript.kernel.api.GosRunner;
import work.goscript.kernel.api.LogLevel;
import work.goscript.kernel.api.RunConfiguration;

@CommandLine.Command(
    name = "goscript-kernel",
    description = "Run value and map scripts against the goscript kernel.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--script"},
        required = true,
        description = "Script file (YAML or JSON).",
        arity = "1..*"
    )
    private List<Path> scripts = new ArrayList<>();

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "TOML configuration overriding the bundled goscript-kernel.toml.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Kernel log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        if (config != null && !Files.isRegularFile(config)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + config);
        }
        LogLevel logLevel = logLevelRaw == null ? null : LogLevel.from(logLevelRaw);

        var runner = new GosRunner();
        int exitCode = 0;
        for (Path script : scripts) {
            var configuration = RunConfiguration.builder()
                .script(script)
                .configFile(config)
                .logLevel(logLevel)
                .build();
            var result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            spec.commandLine().getOut().println(result.toPrettyJson());
        }
        spec.commandLine().getOut().flush();
        return exitCode;
    }
}
