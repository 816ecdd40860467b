package ink.localiser.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of a parsed script. Leaf text nodes carry their raw text, knots and stitches carry a
 * name, and every node keeps a reference to its parent.
 */
public final class ScriptNode {

    private final NodeKind kind;
    private final String text;
    private final String name;
    private final SourcePosition position;
    private final ScriptNode parent;
    private final List<ScriptNode> children = new ArrayList<>();

    private ScriptNode(NodeKind kind, String text, String name, SourcePosition position, ScriptNode parent) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text;
        this.name = name;
        this.position = Objects.requireNonNull(position, "position");
        this.parent = parent;
    }

    public static ScriptNode story(SourcePosition position) {
        return new ScriptNode(NodeKind.STORY, null, null, position, null);
    }

    /**
     * Creates a child of this node and appends it to the children.
     */
    public ScriptNode addChild(NodeKind kind, SourcePosition position) {
        if (kind == NodeKind.TEXT || kind.isNamedScope() || kind == NodeKind.STORY) {
            throw new IllegalArgumentException("Use addText or addScope for " + kind);
        }
        return append(new ScriptNode(kind, null, null, position, this));
    }

    public ScriptNode addText(String text, SourcePosition position) {
        return append(new ScriptNode(NodeKind.TEXT, Objects.requireNonNull(text, "text"), null, position, this));
    }

    public ScriptNode addScope(NodeKind kind, String name, SourcePosition position) {
        if (!kind.isNamedScope()) {
            throw new IllegalArgumentException(kind + " is not a named scope");
        }
        return append(new ScriptNode(kind, null, Objects.requireNonNull(name, "name"), position, this));
    }

    private ScriptNode append(ScriptNode child) {
        children.add(child);
        return child;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Raw text of a {@link NodeKind#TEXT} node, empty for every other kind.
     */
    public String text() {
        return text == null ? "" : text;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public SourcePosition position() {
        return position;
    }

    public Optional<ScriptNode> parent() {
        return Optional.ofNullable(parent);
    }

    public List<ScriptNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Children of this node's parent, including this node. A root has no siblings.
     */
    public List<ScriptNode> siblings() {
        return parent == null ? List.of() : parent.children();
    }

    /**
     * Enclosing nodes from the root down to the direct parent.
     */
    public List<ScriptNode> ancestry() {
        List<ScriptNode> chain = new ArrayList<>();
        for (ScriptNode current = parent; current != null; current = current.parent) {
            chain.add(current);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Depth-first, document-order list of all descendants of the given kind.
     */
    public List<ScriptNode> findAll(NodeKind wanted) {
        List<ScriptNode> found = new ArrayList<>();
        collect(this, wanted, found);
        return found;
    }

    private static void collect(ScriptNode node, NodeKind wanted, List<ScriptNode> found) {
        if (node.kind == wanted) {
            found.add(node);
        }
        for (ScriptNode child : node.children) {
            collect(child, wanted, found);
        }
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TEXT -> "TEXT[" + text.replace("\n", "\\n") + "]@" + position.startLine();
            case KNOT, STITCH -> kind + "[" + name + "]";
            default -> kind.name();
        };
    }
}
