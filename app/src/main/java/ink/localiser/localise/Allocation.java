package ink.localiser.localise;

import ink.localiser.patch.PendingEdit;
import java.util.Objects;
import java.util.Optional;

/**
 * Final ID chosen for a text run and the edit needed to write it, if any.
 */
public record Allocation(TextRun run, String locId, Optional<PendingEdit> edit) {

    public Allocation {
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(locId, "locId");
        edit = edit == null ? Optional.empty() : edit;
    }

    public boolean keptExisting() {
        return edit.isEmpty();
    }
}
