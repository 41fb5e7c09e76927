package work.typeset.layout.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.typeset.layout.api.LayoutRenderer;
import work.typeset.layout.api.LogLevel;
import work.typeset.layout.api.OutputFormat;
import work.typeset.layout.api.RenderConfiguration;
import work.typeset.layout.api.RenderResult;
import work.typeset.layout.api.RenderSettings;

@CommandLine.Command(
    name = Main.COMMAND_NAME,
    description = "Build a layout document into an optimized action stream.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RenderCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--input"},
        required = true,
        description = "Layout document (YAML or JSON)."
    )
    private String input;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the result to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format (compact|diagnostic).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--config",
        description = "TOML settings file; command-line flags take precedence.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = "--debug-boxes",
        description = "Outline every nested layout block."
    )
    private boolean debugBoxes;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--summary",
        description = "Print a JSON run summary to stderr."
    )
    private boolean summary;

    @Override
    public Integer call() {
        Path inputPath = Paths.get(input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(inputPath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Layout document not found: " + inputPath);
        }

        var builder = RenderConfiguration.builder().settings(loadSettings());
        builder.input(inputPath);
        if (output != null) {
            builder.output(Optional.of(Paths.get(output).toAbsolutePath().normalize()));
        }
        if (formatRaw != null) {
            builder.format(OutputFormat.from(formatRaw));
        }
        if (debugBoxes) {
            builder.debugBoxes(true);
        }
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        RenderConfiguration configuration = builder.build();

        RenderResult result = new LayoutRenderer().render(configuration);
        if (result.status() == RenderResult.Status.FAILURE) {
            spec.commandLine().getErr().println(
                spec.commandLine().getColorScheme().errorText(String.valueOf(result.metadata().get("error")))
            );
        } else if (configuration.output().isEmpty()) {
            spec.commandLine().getOut().print(result.output());
            spec.commandLine().getOut().flush();
        }
        if (summary) {
            spec.commandLine().getErr().println(result.toPrettyJson());
        }
        return result.status().exitCode();
    }

    private RenderSettings loadSettings() {
        if (config == null || config.isBlank()) {
            return RenderSettings.empty();
        }
        Path path = Paths.get(config).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Settings file not found: " + path);
        }
        return RenderSettings.load(path);
    }
}
