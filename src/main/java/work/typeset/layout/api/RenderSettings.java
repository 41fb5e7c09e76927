package work.typeset.layout.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;

/**
 * Defaults read from a TOML settings file.
 *
 * <pre>
 * [output]
 * format = "compact"
 * [render]
 * debug = true
 * [log]
 * level = "info"
 * </pre>
 */
public record RenderSettings(
    Optional<OutputFormat> format,
    Optional<Boolean> debugBoxes,
    Optional<LogLevel> logLevel
) {
    public RenderSettings {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(debugBoxes, "debugBoxes");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static RenderSettings empty() {
        return new RenderSettings(Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static RenderSettings load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static RenderSettings parse(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings: " + errors);
        }
        try {
            return new RenderSettings(
                Optional.ofNullable(result.getString("output.format")).map(OutputFormat::from),
                Optional.ofNullable(result.getBoolean("render.debug")),
                Optional.ofNullable(result.getString("log.level")).map(LogLevel::from)
            );
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid settings: " + ex.getMessage(), ex);
        }
    }
}
