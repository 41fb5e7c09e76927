package work.typeset.layout.size;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Small helper to parse user-friendly lengths (e.g. {@code 12pt}, {@code 5mm}, {@code 2.5cm}, {@code 1in}).
 * A bare number is read as points.
 */
public final class SizeParser {
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private SizeParser() {}

    public static Optional<Size> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        double multiplier = 1.0;
        if (trimmed.endsWith("pt")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("mm")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = Size.POINTS_PER_MM;
        } else if (trimmed.endsWith("cm")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = Size.POINTS_PER_CM;
        } else if (trimmed.endsWith("in")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = Size.POINTS_PER_INCH;
        }
        String number = trimmed.trim();
        if (!NUMBER.matcher(number).matches()) {
            throw new IllegalArgumentException("Invalid size: " + raw);
        }
        double value = Double.parseDouble(number);
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Invalid size: " + raw);
        }
        return Optional.of(Size.pt(value * multiplier));
    }
}
