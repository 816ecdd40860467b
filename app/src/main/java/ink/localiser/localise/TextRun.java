package ink.localiser.localise;

import ink.localiser.script.NodeKind;
import ink.localiser.script.ScriptNode;
import java.util.Objects;

/**
 * A text node accepted for localisation, with its resolved file and end position.
 */
public record TextRun(ScriptNode node, String fileName, String fileId, int startLine, int endLine, int endColumn) {

    public TextRun {
        Objects.requireNonNull(node, "node");
        if (node.kind() != NodeKind.TEXT) {
            throw new IllegalArgumentException("Only text nodes can be localised, got " + node.kind());
        }
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(fileId, "fileId");
    }

    public static TextRun of(ScriptNode node) {
        var position = node.position();
        return new TextRun(node, position.fileName(), position.fileId(),
                position.startLine(), position.endLine(), position.endColumn());
    }

    public String text() {
        return node.text();
    }
}
