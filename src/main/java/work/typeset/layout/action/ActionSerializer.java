package work.typeset.layout.action;

import java.io.IOException;
import java.util.Objects;

/**
 * Renders actions into the compact wire form and into a readable diagnostic form.
 *
 * <p>Compact form, one action per call:
 * <pre>
 * m &lt;x&gt; &lt;y&gt;          absolute move
 * f &lt;index&gt; &lt;size&gt;   set font
 * w &lt;text&gt;           write text (verbatim)
 * b &lt;x&gt; &lt;y&gt; &lt;w&gt; &lt;h&gt;  debug box
 * </pre>
 * Positions and extents are points with four decimals; the font size uses its shortest form.
 */
public final class ActionSerializer {
    private ActionSerializer() {}

    public static String serialize(Action action) {
        Objects.requireNonNull(action, "action");
        if (action instanceof Action.Move move) {
            return "m " + move.position().x().toFixedPoints() + " " + move.position().y().toFixedPoints();
        }
        if (action instanceof Action.SetFont font) {
            return "f " + font.index() + " " + font.size().toNaturalPoints();
        }
        if (action instanceof Action.WriteText text) {
            return "w " + text.text();
        }
        if (action instanceof Action.DebugBox box) {
            return "b " + box.position().x().toFixedPoints()
                + " " + box.position().y().toFixedPoints()
                + " " + box.size().x().toFixedPoints()
                + " " + box.size().y().toFixedPoints();
        }
        throw new IllegalStateException("Unsupported action: " + action.getClass().getName());
    }

    /**
     * Writes the compact form of {@code action} to {@code out}. The action is rendered fully
     * before the sink is touched, so a failing sink never receives half an action from here.
     */
    public static void serialize(Action action, Appendable out) throws IOException {
        Objects.requireNonNull(out, "out");
        out.append(serialize(action));
    }

    public static String describe(Action action) {
        Objects.requireNonNull(action, "action");
        if (action instanceof Action.Move move) {
            return "move " + move.position().x() + " " + move.position().y();
        }
        if (action instanceof Action.SetFont font) {
            return "font " + font.index() + " " + font.size();
        }
        if (action instanceof Action.WriteText text) {
            return "write \"" + text.text() + "\"";
        }
        if (action instanceof Action.DebugBox box) {
            return "box " + box.position() + " " + box.size();
        }
        throw new IllegalStateException("Unsupported action: " + action.getClass().getName());
    }
}
