package ink.localiser.patch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups pending edits by file. Files keep the order of their first edit and edits keep the order
 * they were produced in.
 */
public class PatchPlanner {

    public List<FilePatch> plan(List<PendingEdit> edits) {
        if (edits == null || edits.isEmpty()) {
            return List.of();
        }
        Map<String, List<PendingEdit>> byFile = new LinkedHashMap<>();
        for (PendingEdit edit : edits) {
            byFile.computeIfAbsent(edit.fileName(), key -> new ArrayList<>()).add(edit);
        }
        List<FilePatch> patches = new ArrayList<>(byFile.size());
        byFile.forEach((fileName, fileEdits) -> patches.add(new FilePatch(fileName, fileEdits)));
        return List.copyOf(patches);
    }
}
