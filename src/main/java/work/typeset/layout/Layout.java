package work.typeset.layout;

import java.util.List;
import java.util.Objects;
import work.typeset.layout.action.Action;
import work.typeset.layout.action.ActionBuffer;
import work.typeset.layout.size.Size2D;

/**
 * A finished box: its extent, its actions in its own coordinate frame, and whether a debug
 * outline should be drawn when it is placed into a parent.
 */
public record Layout(Size2D dimensions, List<Action> actions, boolean debugRender) {
    public Layout {
        Objects.requireNonNull(dimensions, "dimensions");
        actions = List.copyOf(actions);
    }

    public static Layout of(Size2D dimensions, ActionBuffer buffer) {
        return of(dimensions, buffer, false);
    }

    public static Layout of(Size2D dimensions, ActionBuffer buffer, boolean debugRender) {
        Objects.requireNonNull(buffer, "buffer");
        return new Layout(dimensions, buffer.finish(), debugRender);
    }
}
