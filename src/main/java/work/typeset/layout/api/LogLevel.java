package work.typeset.layout.api;

import java.util.Locale;

/**
 * Renderer log thresholds. Messages below the configured level are dropped.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public boolean enables(LogLevel message) {
        return message.compareTo(this) >= 0;
    }
}
