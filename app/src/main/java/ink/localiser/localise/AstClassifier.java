package ink.localiser.localise;

import ink.localiser.script.NodeKind;
import ink.localiser.script.ScriptNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a parsed story in document order and selects the text runs that can carry a
 * localisation tag.
 *
 * <p>Rules, checked in this order for every text node:
 * <ol>
 *     <li>whitespace-only text is layout and skipped;</li>
 *     <li>text inside a tag span is tag content and skipped;</li>
 *     <li>text whose parent is an assignment or string expression is code and skipped;</li>
 *     <li>a second accepted run on the same file and line is a conflict and stops classification;</li>
 *     <li>text from a file visited by an earlier document is skipped.</li>
 * </ol>
 * Files seen for the first time are marked visited only after the whole story was scanned.
 */
public class AstClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(AstClassifier.class);

    public Classification classify(ScriptNode story, VisitedFileSet visitedFiles) {
        Objects.requireNonNull(story, "story");
        Objects.requireNonNull(visitedFiles, "visitedFiles");

        List<TextRun> runs = new ArrayList<>();
        Set<String> newFileIds = new LinkedHashSet<>();
        Set<LineKey> acceptedLines = new HashSet<>();

        for (ScriptNode text : story.findAll(NodeKind.TEXT)) {
            if (text.text().isBlank()) {
                continue;
            }
            if (TagRegions.isInsideTag(text)) {
                continue;
            }
            if (isInsideCode(text)) {
                LOGGER.debug("Skipping text inside code: {}", text);
                continue;
            }

            TextRun run = TextRun.of(text);
            if (!acceptedLines.add(new LineKey(run.fileName(), run.startLine()))) {
                return Classification.rejected(new Classification.LineConflict(run.fileName(), run.startLine()));
            }

            if (visitedFiles.contains(run.fileId())) {
                continue;
            }
            newFileIds.add(run.fileId());
            LOGGER.debug("Eligible text {}:{} '{}'", run.fileName(), run.startLine(), run.text());
            runs.add(run);
        }

        visitedFiles.addAll(newFileIds);
        return Classification.accepted(runs, newFileIds);
    }

    private static boolean isInsideCode(ScriptNode text) {
        return text.parent()
                .map(parent -> parent.kind().isCodeContext())
                .orElse(false);
    }

    private record LineKey(String fileName, int line) {
    }
}
