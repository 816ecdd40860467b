package ink.localiser.patch;

import java.util.List;
import java.util.Objects;

/**
 * Pending edits for one source file, in the order they were produced.
 */
public record FilePatch(String fileName, List<PendingEdit> edits) {

    public FilePatch {
        Objects.requireNonNull(fileName, "fileName");
        edits = List.copyOf(Objects.requireNonNull(edits, "edits"));
    }
}
