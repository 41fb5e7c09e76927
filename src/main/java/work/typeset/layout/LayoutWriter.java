package work.typeset.layout;

import java.io.IOException;
import java.util.Objects;
import work.typeset.layout.action.Action;
import work.typeset.layout.action.ActionSerializer;

/**
 * Writes layouts in the line-oriented compact form read by renderers.
 *
 * <pre>
 * &lt;width&gt; &lt;height&gt;
 * &lt;action count&gt;
 * &lt;one compact action per line&gt;
 * </pre>
 *
 * A {@link MultiLayout} is prefixed by its layout count on a line of its own. Each line is
 * fully rendered before it reaches the sink; sink failures propagate as {@link IOException}.
 */
public final class LayoutWriter {
    private static final String NEWLINE = "\n";

    private LayoutWriter() {}

    public static void write(Layout layout, Appendable out) throws IOException {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(out, "out");
        out.append(layout.dimensions().x().toFixedPoints())
            .append(' ')
            .append(layout.dimensions().y().toFixedPoints())
            .append(NEWLINE);
        out.append(Integer.toString(layout.actions().size())).append(NEWLINE);
        for (Action action : layout.actions()) {
            out.append(ActionSerializer.serialize(action)).append(NEWLINE);
        }
    }

    public static void write(MultiLayout layouts, Appendable out) throws IOException {
        Objects.requireNonNull(layouts, "layouts");
        Objects.requireNonNull(out, "out");
        out.append(Integer.toString(layouts.count())).append(NEWLINE);
        for (Layout layout : layouts) {
            write(layout, out);
        }
    }

    /**
     * Writes one diagnostic line per action, for humans rather than renderers.
     */
    public static void describe(Layout layout, Appendable out) throws IOException {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(out, "out");
        out.append("layout ").append(layout.dimensions().toString()).append(NEWLINE);
        for (Action action : layout.actions()) {
            out.append("  ").append(ActionSerializer.describe(action)).append(NEWLINE);
        }
    }

    public static void describe(MultiLayout layouts, Appendable out) throws IOException {
        Objects.requireNonNull(layouts, "layouts");
        for (Layout layout : layouts) {
            describe(layout, out);
        }
    }
}
