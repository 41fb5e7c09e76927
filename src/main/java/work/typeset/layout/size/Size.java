package work.typeset.layout.size;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * A length, stored in typographic points.
 */
public record Size(double points) implements Comparable<Size> {
    public static final double POINTS_PER_INCH = 72.0;
    public static final double POINTS_PER_MM = 2.83465;
    public static final double POINTS_PER_CM = 28.3465;

    private static final Size ZERO = new Size(0);

    public Size {
        if (!Double.isFinite(points)) {
            throw new IllegalArgumentException("Size must be finite: " + points);
        }
        // folds -0.0 into 0.0 so equal lengths compare equal
        points = points + 0.0;
    }

    public static Size zero() {
        return ZERO;
    }

    public static Size pt(double points) {
        return new Size(points);
    }

    public static Size mm(double mm) {
        return new Size(mm * POINTS_PER_MM);
    }

    public static Size cm(double cm) {
        return new Size(cm * POINTS_PER_CM);
    }

    public static Size in(double inches) {
        return new Size(inches * POINTS_PER_INCH);
    }

    public double toPt() {
        return points;
    }

    public double toMm() {
        return points / POINTS_PER_MM;
    }

    public double toCm() {
        return points / POINTS_PER_CM;
    }

    public double toIn() {
        return points / POINTS_PER_INCH;
    }

    public Size plus(Size other) {
        return new Size(points + other.points);
    }

    public Size minus(Size other) {
        return new Size(points - other.points);
    }

    public Size times(double factor) {
        return new Size(points * factor);
    }

    public Size max(Size other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public Size min(Size other) {
        return compareTo(other) <= 0 ? this : other;
    }

    @Override
    public int compareTo(Size other) {
        return Double.compare(points, other.points);
    }

    /**
     * Renders the point value with exactly four decimals ({@code 3.5000}).
     */
    public String toFixedPoints() {
        return String.format(Locale.ROOT, "%.4f", points);
    }

    /**
     * Renders the point value in its shortest decimal form ({@code 12}, {@code 10.5}).
     */
    public String toNaturalPoints() {
        return natural(points);
    }

    static String natural(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return natural(points) + "pt";
    }
}
