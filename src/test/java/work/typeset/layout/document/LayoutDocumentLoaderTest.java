package work.typeset.layout.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.typeset.layout.Layout;
import work.typeset.layout.action.ActionSerializer;
import work.typeset.layout.size.Size2D;

class LayoutDocumentLoaderTest {
    private static Path fixture(String name) {
        return Path.of("src", "test", "resources", "layouts", name).toAbsolutePath();
    }

    private static List<String> compact(Layout layout) {
        return layout.actions().stream().map(ActionSerializer::serialize).collect(Collectors.toList());
    }

    @Test
    void composesNestedBlocksIntoParentFrame() {
        var layouts = new LayoutDocumentLoader().loadFromLocalFile(fixture("nested.yaml"));

        assertEquals(1, layouts.count());
        var root = layouts.layouts().get(0);
        assertEquals(Size2D.pt(200, 100), root.dimensions());
        assertEquals(
            List.of(
                "m 10.0000 10.0000",
                "f 0 12",
                "w hi",
                "b 50.0000 20.0000 40.0000 30.0000",
                "m 55.0000 25.0000",
                "w inner",
                "w after"
            ),
            compact(root)
        );
    }

    @Test
    void loadsJsonPagesWithUnits() {
        var layouts = new LayoutDocumentLoader().loadFromLocalFile(fixture("pages.json"));

        assertEquals(2, layouts.count());
        assertEquals(List.of("m 28.3465 0.0000", "f 1 10.5", "w page one"), compact(layouts.layouts().get(0)));
        assertEquals(Size2D.pt(72, 72), layouts.layouts().get(1).dimensions());
        assertEquals(
            List.of("b 1.0000 2.0000 3.0000 4.0000", "m 10.0000 10.0000", "w boxed"),
            compact(layouts.layouts().get(1))
        );
    }

    @Test
    void forcedDebugOutlinesNestedBlocks() {
        var layouts = new LayoutDocumentLoader(true).loadFromLocalFile(fixture("pages.json"));

        assertEquals(
            List.of(
                "b 1.0000 2.0000 3.0000 4.0000",
                "b 10.0000 10.0000 20.0000 20.0000",
                "m 10.0000 10.0000",
                "w boxed"
            ),
            compact(layouts.layouts().get(1))
        );
    }

    @Test
    void parsesInlineDocument() {
        var layouts = new LayoutDocumentLoader().parse(
            "width: 10\nheight: 10\nactions:\n  - move: [1, 2]\n  - font: [0, 9]\n  - font: [0, 9]\n  - write: x\n"
        );

        assertEquals(List.of("m 1.0000 2.0000", "f 0 9", "w x"), compact(layouts.layouts().get(0)));
    }

    @Test
    void keepsFirstFontWithLargestIndex() {
        var layouts = new LayoutDocumentLoader().parse("actions:\n  - font: [2147483647, 0]\n  - write: x\n");

        assertEquals(List.of("f 2147483647 0", "w x"), compact(layouts.layouts().get(0)));
    }

    @Test
    void emptyDocumentHasNoLayouts() {
        assertTrue(new LayoutDocumentLoader().parse("").layouts().isEmpty());
    }

    @Test
    void rejectsUnknownAction() {
        var ex = assertThrows(
            IllegalArgumentException.class,
            () -> new LayoutDocumentLoader().loadFromLocalFile(fixture("broken.yaml"))
        );
        assertTrue(ex.getMessage().contains("rotate"));
    }

    @Test
    void rejectsMalformedEntries() {
        var loader = new LayoutDocumentLoader();
        assertThrows(IllegalArgumentException.class, () -> loader.parse("actions:\n  - move: [1]\n"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("actions:\n  - font: [-1, 12]\n"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("actions:\n  - move: [1, 2]\n    write: x\n"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("width: wide\n"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("- just a list\n"));
    }

    @Test
    void reportsMissingFile() {
        assertThrows(
            IllegalStateException.class,
            () -> new LayoutDocumentLoader().loadFromLocalFile(fixture("missing.yaml"))
        );
    }
}
