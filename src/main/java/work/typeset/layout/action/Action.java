package work.typeset.layout.action;

import java.util.Objects;
import work.typeset.layout.size.Size;
import work.typeset.layout.size.Size2D;

/**
 * A single layout instruction: drawing or configuration.
 *
 * <p>The variant set is closed. {@link ActionBuffer} decides per variant whether the
 * action is cached for coalescing or committed, and {@link ActionSerializer} renders
 * each variant into its compact and diagnostic forms.
 */
public sealed interface Action permits Action.Move, Action.SetFont, Action.WriteText, Action.DebugBox {

    static Move move(Size2D position) {
        return new Move(position);
    }

    static Move move(double x, double y) {
        return new Move(Size2D.pt(x, y));
    }

    static SetFont setFont(int index, Size size) {
        return new SetFont(index, size);
    }

    static WriteText writeText(String text) {
        return new WriteText(text);
    }

    static DebugBox debugBox(Size2D position, Size2D size) {
        return new DebugBox(position, size);
    }

    /**
     * Move to an absolute position.
     */
    record Move(Size2D position) implements Action {
        public Move {
            Objects.requireNonNull(position, "position");
        }

        @Override
        public String toString() {
            return ActionSerializer.describe(this);
        }
    }

    /**
     * Select a font by its index in the font table and a font size.
     */
    record SetFont(int index, Size size) implements Action {
        public SetFont {
            if (index < 0) {
                throw new IllegalArgumentException("Font index must be non-negative: " + index);
            }
            Objects.requireNonNull(size, "size");
        }

        @Override
        public String toString() {
            return ActionSerializer.describe(this);
        }
    }

    /**
     * Write text starting at the current position with the active font.
     */
    record WriteText(String text) implements Action {
        public WriteText {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String toString() {
            return ActionSerializer.describe(this);
        }
    }

    /**
     * Outline a box for debugging. Carries the top-left position and the extent.
     */
    record DebugBox(Size2D position, Size2D size) implements Action {
        public DebugBox {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(size, "size");
        }

        @Override
        public String toString() {
            return ActionSerializer.describe(this);
        }
    }
}
