package work.typeset.layout.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.LinkedHashMap;
import work.typeset.layout.LayoutWriter;
import work.typeset.layout.MultiLayout;
import work.typeset.layout.document.LayoutDocumentLoader;

/**
 * Public entry point for turning a layout document into serialized actions.
 */
public final class LayoutRenderer {

    public RenderResult render(RenderConfiguration configuration) {
        var started = Instant.now();
        try {
            log(configuration, LogLevel.DEBUG, "Loading layout document %s", configuration.input());
            var layouts = new LayoutDocumentLoader(configuration.debugBoxes())
                .loadFromLocalFile(configuration.input());
            int actionCount = layouts.layouts().stream().mapToInt(layout -> layout.actions().size()).sum();
            log(configuration, LogLevel.INFO, "Built %d layout(s) with %d action(s)", layouts.count(), actionCount);

            String rendered = serialize(layouts, configuration.format());
            if (configuration.output().isPresent()) {
                var target = configuration.output().get();
                var parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, rendered, StandardCharsets.UTF_8);
                log(configuration, LogLevel.INFO, "Wrote %s", target);
            }

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("input", configuration.input().toString());
            metadata.put("format", configuration.format().name().toLowerCase());
            metadata.put("layouts", layouts.count());
            metadata.put("actions", actionCount);
            configuration.output().ifPresent(path -> metadata.put("output", path.toString()));
            return RenderResult.success(rendered, metadata, started);
        } catch (Exception ex) {
            String message = errorMessage(ex);
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("input", configuration.input().toString());
            errorMeta.put("error", message);
            log(configuration, LogLevel.ERROR, "Render failed: %s", message);
            if (Boolean.getBoolean("layout.debug")) {
                ex.printStackTrace();
            }
            return RenderResult.failure(message, errorMeta, started);
        }
    }

    static String errorMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    static String serialize(MultiLayout layouts, OutputFormat format) throws IOException {
        var out = new StringBuilder();
        switch (format) {
            case COMPACT -> LayoutWriter.write(layouts, out);
            case DIAGNOSTIC -> LayoutWriter.describe(layouts, out);
        }
        return out.toString();
    }

    private static void log(RenderConfiguration configuration, LogLevel level, String format, Object... args) {
        if (configuration.logLevel().enables(level)) {
            System.err.println("[" + level.name().toLowerCase() + "] " + String.format(format, args));
        }
    }
}
