package ink.localiser.localise;

import ink.localiser.script.NodeKind;
import ink.localiser.script.ScriptNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers tag span questions for a node by scanning its siblings with a signed depth counter.
 *
 * <p>Start markers add one, end markers subtract one. Unbalanced markers are not reported; a
 * negative depth simply counts as outside any tag.
 */
public final class TagRegions {

    private TagRegions() {
    }

    /**
     * True when more tags were opened than closed among the siblings before {@code node}.
     */
    public static boolean isInsideTag(ScriptNode node) {
        int depth = 0;
        for (ScriptNode sibling : node.siblings()) {
            if (sibling == node) {
                break;
            }
            depth += delta(sibling);
        }
        return depth > 0;
    }

    /**
     * Text of every sibling after {@code node} that sits inside a tag span, in order.
     */
    public static List<String> tagsAfter(ScriptNode node) {
        List<String> tags = new ArrayList<>();
        boolean afterNode = false;
        int depth = 0;
        for (ScriptNode sibling : node.siblings()) {
            if (sibling == node) {
                afterNode = true;
                continue;
            }
            if (!afterNode) {
                continue;
            }
            if (sibling.kind().isTagMarker()) {
                depth += delta(sibling);
            } else if (depth > 0 && sibling.kind() == NodeKind.TEXT) {
                tags.add(sibling.text());
            }
        }
        return tags;
    }

    private static int delta(ScriptNode node) {
        return switch (node.kind()) {
            case TAG_START -> 1;
            case TAG_END -> -1;
            default -> 0;
        };
    }
}
