package ink.localiser.localise;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered mapping from localisation ID to source text collected during a run. A repeated ID keeps
 * its first position and takes the latest text.
 */
public class StringTable {

    private final Map<String, String> entries = new LinkedHashMap<>();

    public void put(String locId, String text) {
        entries.put(Objects.requireNonNull(locId, "locId"), Objects.requireNonNull(text, "text"));
    }

    public boolean contains(String locId) {
        return entries.containsKey(locId);
    }

    public Optional<String> get(String locId) {
        return Optional.ofNullable(entries.get(locId));
    }

    public int size() {
        return entries.size();
    }

    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
