package work.typeset.layout.api;

import java.util.Locale;

/**
 * How rendered layouts are written out.
 */
public enum OutputFormat {
    /** Line-oriented compact form consumed by renderers. */
    COMPACT,
    /** Readable one-action-per-line listing. */
    DIAGNOSTIC;

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return COMPACT;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value);
        }
    }
}
