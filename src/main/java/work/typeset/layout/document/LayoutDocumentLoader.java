package work.typeset.layout.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import work.typeset.layout.Layout;
import work.typeset.layout.MultiLayout;
import work.typeset.layout.action.Action;
import work.typeset.layout.action.ActionBuffer;
import work.typeset.layout.size.Size;
import work.typeset.layout.size.Size2D;
import work.typeset.layout.size.SizeParser;

/**
 * Loads layout descriptions (YAML or JSON) and builds them through {@link ActionBuffer}.
 *
 * <p>A document is either a single block or {@code pages: [block, ...]}. A block has
 * {@code width}, {@code height}, an optional {@code debug} flag and a list of {@code actions};
 * each action is a single-key object ({@code move}, {@code font}, {@code write}, {@code box}
 * or a nested {@code layout} placed {@code at} a position in its parent).
 */
public final class LayoutDocumentLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final boolean forceDebug;

    public LayoutDocumentLoader() {
        this(false);
    }

    /**
     * @param forceDebug outline every nested block, whatever its own {@code debug} flag says
     */
    public LayoutDocumentLoader(boolean forceDebug) {
        this.forceDebug = forceDebug;
    }

    public MultiLayout loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read layout document: " + path, ex);
        }
    }

    public MultiLayout parse(String text) {
        try {
            return fromTree(YAML_MAPPER.readTree(text));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed layout document: " + ex.getMessage(), ex);
        }
    }

    public MultiLayout parse(InputStream in) throws IOException {
        return fromTree(YAML_MAPPER.readTree(in));
    }

    private MultiLayout fromTree(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new MultiLayout(List.of());
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Layout document must be an object: " + root);
        }
        if (root.has("pages")) {
            var pagesNode = root.get("pages");
            if (!pagesNode.isArray()) {
                throw new IllegalArgumentException("'pages' must be a list: " + pagesNode);
            }
            var pages = new ArrayList<Layout>();
            for (var page : pagesNode) {
                pages.add(buildBlock(page, false));
            }
            return new MultiLayout(pages);
        }
        return MultiLayout.of(buildBlock(root, false));
    }

    private Layout buildBlock(JsonNode node, boolean nested) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Layout block must be an object: " + node);
        }
        var dimensions = new Size2D(
            sizeOrZero(node.get("width"), "width"),
            sizeOrZero(node.get("height"), "height")
        );
        boolean debug = (nested && forceDebug) || node.path("debug").asBoolean(false);

        var buffer = new ActionBuffer();
        var actions = node.get("actions");
        if (actions != null && !actions.isNull()) {
            if (!actions.isArray()) {
                throw new IllegalArgumentException("'actions' must be a list: " + actions);
            }
            for (var entry : actions) {
                applyEntry(buffer, entry);
            }
        }
        return Layout.of(dimensions, buffer, debug);
    }

    private void applyEntry(ActionBuffer buffer, JsonNode entry) {
        if (entry == null || !entry.isObject() || entry.size() != 1) {
            throw new IllegalArgumentException("Action entry must be an object with exactly one key: " + entry);
        }
        var field = entry.fields().next();
        var key = field.getKey();
        var value = field.getValue();
        switch (key) {
            case "move" -> buffer.add(Action.move(toPair(value, "move")));
            case "font" -> buffer.add(toFont(value));
            case "write" -> {
                if (!value.isValueNode() || value.isNull()) {
                    throw new IllegalArgumentException("'write' expects a text value: " + entry);
                }
                buffer.add(Action.writeText(value.asText()));
            }
            case "box" -> {
                if (!value.isObject()) {
                    throw new IllegalArgumentException("'box' expects {at, size}: " + entry);
                }
                buffer.add(Action.debugBox(toPair(value.get("at"), "box.at"), toPair(value.get("size"), "box.size")));
            }
            case "layout" -> {
                var at = value.has("at") ? toPair(value.get("at"), "layout.at") : Size2D.zero();
                buffer.compose(at, buildBlock(value, true));
            }
            default -> throw new IllegalArgumentException("Unknown action '" + key + "': " + entry);
        }
    }

    private static Action.SetFont toFont(JsonNode value) {
        JsonNode indexNode;
        JsonNode sizeNode;
        if (value.isArray() && value.size() == 2) {
            indexNode = value.get(0);
            sizeNode = value.get(1);
        } else if (value.isObject()) {
            indexNode = value.get("index");
            sizeNode = value.get("size");
        } else {
            throw new IllegalArgumentException("'font' expects [index, size] or {index, size}: " + value);
        }
        if (indexNode == null || !indexNode.canConvertToInt() || !indexNode.isIntegralNumber() || indexNode.intValue() < 0) {
            throw new IllegalArgumentException("Font index must be a non-negative integer: " + indexNode);
        }
        return Action.setFont(indexNode.intValue(), toSize(sizeNode, "font.size"));
    }

    private static Size2D toPair(JsonNode value, String label) {
        if (value != null && value.isArray() && value.size() == 2) {
            return new Size2D(toSize(value.get(0), label), toSize(value.get(1), label));
        }
        if (value != null && value.isObject()) {
            return new Size2D(toSize(value.get("x"), label + ".x"), toSize(value.get("y"), label + ".y"));
        }
        throw new IllegalArgumentException("'" + label + "' expects [x, y] or {x, y}: " + value);
    }

    private static Size sizeOrZero(JsonNode value, String label) {
        if (value == null || value.isNull()) {
            return Size.zero();
        }
        return toSize(value, label);
    }

    private static Size toSize(JsonNode value, String label) {
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing size for '" + label + "'");
        }
        if (value.isNumber()) {
            return Size.pt(value.doubleValue());
        }
        if (value.isTextual()) {
            return SizeParser.parse(value.asText())
                .orElseThrow(() -> new IllegalArgumentException("Empty size for '" + label + "'"));
        }
        throw new IllegalArgumentException("Invalid size for '" + label + "': " + value);
    }
}
