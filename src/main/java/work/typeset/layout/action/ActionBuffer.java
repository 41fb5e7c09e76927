package work.typeset.layout.action;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.typeset.layout.Layout;
import work.typeset.layout.size.Size;
import work.typeset.layout.size.Size2D;

/**
 * Accumulates layout actions and optimizes them while they are added.
 *
 * <p>Configuration actions (moves and font changes) are cached and only committed when
 * content is written. Repeated moves collapse into the last one, and a font change is only
 * committed if the font is not already active. Debug boxes are committed right away and
 * leave the cached state alone.
 *
 * <p>The buffer can also translate positions into a frame with a different origin:
 * {@link #compose(Size2D, Layout)} places a sub-layout at a position, which translates every
 * move inside it by that position. The origin is a single value, not a stack; it stays in
 * effect until the next {@code compose} call.
 *
 * <p>Instances are not thread-safe and are meant to be owned by a single layouting routine.
 */
public final class ActionBuffer {
    private final List<Action> committed = new ArrayList<>();
    private Size2D origin = Size2D.zero();
    // null until the first font change is committed
    private FontState activeFont;
    private Size2D pendingMove;
    private FontState pendingFont;
    private boolean finished;

    public ActionBuffer add(Action action) {
        Objects.requireNonNull(action, "action");
        ensureOpen();
        if (action instanceof Action.Move move) {
            pendingMove = origin.plus(move.position());
        } else if (action instanceof Action.SetFont font) {
            pendingFont = new FontState(font.index(), font.size());
        } else if (action instanceof Action.DebugBox box) {
            committed.add(new Action.DebugBox(origin.plus(box.position()), box.size()));
        } else {
            flush();
            committed.add(action);
        }
        return this;
    }

    public ActionBuffer addAll(Iterable<? extends Action> actions) {
        Objects.requireNonNull(actions, "actions");
        for (Action action : actions) {
            add(action);
        }
        return this;
    }

    /**
     * Adds a sub-layout at {@code position}. All moves inside the layout are translated by it.
     */
    public ActionBuffer compose(Size2D position, Layout layout) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(layout, "layout");
        ensureOpen();
        flushMove();

        origin = position;
        pendingMove = position;

        if (layout.debugRender()) {
            committed.add(new Action.DebugBox(position, layout.dimensions()));
        }
        return addAll(layout.actions());
    }

    public Size2D origin() {
        return origin;
    }

    /**
     * Whether nothing has been committed yet. Cached moves and fonts do not count.
     */
    public boolean isEmpty() {
        return committed.isEmpty();
    }

    public int size() {
        return committed.size();
    }

    /**
     * Returns the committed actions. The buffer cannot be used afterwards.
     */
    public List<Action> finish() {
        ensureOpen();
        finished = true;
        return Collections.unmodifiableList(committed);
    }

    // Cached state is always flushed move first, then font.
    private void flush() {
        flushMove();
        flushFont();
    }

    private void flushMove() {
        if (pendingMove != null) {
            committed.add(new Action.Move(pendingMove));
            pendingMove = null;
        }
    }

    private void flushFont() {
        if (pendingFont != null) {
            if (!Objects.equals(pendingFont, activeFont)) {
                committed.add(new Action.SetFont(pendingFont.index(), pendingFont.size()));
                activeFont = pendingFont;
            }
            pendingFont = null;
        }
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Action buffer already finished");
        }
    }

    private record FontState(int index, Size size) {}

    @Override
    public String toString() {
        return "ActionBuffer{" +
            "committed=" + committed.size() +
            ", origin=" + origin +
            ", pendingMove=" + pendingMove +
            ", pendingFont=" + pendingFont +
            ", finished=" + finished +
            '}';
    }
}
