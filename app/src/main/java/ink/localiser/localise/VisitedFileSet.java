package ink.localiser.localise;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * File IDs already classified during this run. Only grows.
 */
public class VisitedFileSet {

    private final Set<String> fileIds = new LinkedHashSet<>();

    public boolean contains(String fileId) {
        return fileIds.contains(fileId);
    }

    public void addAll(Collection<String> newFileIds) {
        fileIds.addAll(newFileIds);
    }

    public Set<String> fileIds() {
        return Collections.unmodifiableSet(fileIds);
    }
}
