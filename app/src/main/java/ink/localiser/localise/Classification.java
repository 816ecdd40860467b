package ink.localiser.localise;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Result of classifying one document: the eligible runs in document order, or the line conflict
 * that stopped classification.
 */
public record Classification(List<TextRun> runs, Set<String> newFileIds, Optional<LineConflict> conflict) {

    public Classification {
        runs = List.copyOf(runs == null ? List.of() : runs);
        newFileIds = Set.copyOf(newFileIds == null ? Set.of() : newFileIds);
        conflict = conflict == null ? Optional.empty() : conflict;
    }

    public static Classification accepted(List<TextRun> runs, Set<String> newFileIds) {
        return new Classification(runs, newFileIds, Optional.empty());
    }

    public static Classification rejected(LineConflict conflict) {
        return new Classification(List.of(), Set.of(), Optional.of(conflict));
    }

    public boolean isConflict() {
        return conflict.isPresent();
    }

    /**
     * Two localisable text runs found on the same physical line.
     */
    public record LineConflict(String fileName, int lineNumber) {

        public String message() {
            return "Error in " + fileName + " line " + lineNumber
                    + " - two chunks of text when localiser can only work with one per line.";
        }
    }
}
