package work.typeset.layout;

import java.util.Iterator;
import java.util.List;

/**
 * An ordered collection of layouts, typically one per page.
 */
public record MultiLayout(List<Layout> layouts) implements Iterable<Layout> {
    public MultiLayout {
        layouts = List.copyOf(layouts);
    }

    public static MultiLayout of(Layout... layouts) {
        return new MultiLayout(List.of(layouts));
    }

    public int count() {
        return layouts.size();
    }

    @Override
    public Iterator<Layout> iterator() {
        return layouts.iterator();
    }
}
