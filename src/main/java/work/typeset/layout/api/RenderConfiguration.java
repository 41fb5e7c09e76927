package work.typeset.layout.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for a {@link LayoutRenderer} run.
 */
public record RenderConfiguration(
    Path input,
    Optional<Path> output,
    OutputFormat format,
    boolean debugBoxes,
    LogLevel logLevel
) {
    public RenderConfiguration {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path input;
        private Optional<Path> output = Optional.empty();
        private OutputFormat format = OutputFormat.COMPACT;
        private boolean debugBoxes;
        private LogLevel logLevel = LogLevel.FATAL;

        /**
         * Seeds the builder from a settings file; later calls override these values.
         */
        public Builder settings(RenderSettings settings) {
            settings.format().ifPresent(value -> this.format = value);
            settings.debugBoxes().ifPresent(value -> this.debugBoxes = value);
            settings.logLevel().ifPresent(value -> this.logLevel = value);
            return this;
        }

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public Builder output(Optional<Path> output) {
            this.output = output;
            return this;
        }

        public Builder format(OutputFormat format) {
            this.format = format;
            return this;
        }

        public Builder debugBoxes(boolean debugBoxes) {
            this.debugBoxes = debugBoxes;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RenderConfiguration build() {
            return new RenderConfiguration(input, output, format, debugBoxes, logLevel);
        }
    }
}
