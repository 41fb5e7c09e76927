package work.typeset.layout.size;

import java.util.Objects;

/**
 * A pair of lengths, used both for positions and for extents.
 */
public record Size2D(Size x, Size y) {
    private static final Size2D ZERO = new Size2D(Size.zero(), Size.zero());

    public Size2D {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
    }

    public static Size2D zero() {
        return ZERO;
    }

    public static Size2D pt(double x, double y) {
        return new Size2D(Size.pt(x), Size.pt(y));
    }

    public Size2D plus(Size2D other) {
        return new Size2D(x.plus(other.x), y.plus(other.y));
    }

    public Size2D minus(Size2D other) {
        return new Size2D(x.minus(other.x), y.minus(other.y));
    }

    public Size2D withX(Size newX) {
        return new Size2D(newX, y);
    }

    public Size2D withY(Size newY) {
        return new Size2D(x, newY);
    }

    @Override
    public String toString() {
        return "[" + x + ", " + y + "]";
    }
}
