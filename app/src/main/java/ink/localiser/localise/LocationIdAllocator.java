package ink.localiser.localise;

import ink.localiser.patch.PendingEdit;
import ink.localiser.script.ScriptNode;
import java.util.Objects;
import java.util.Optional;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the localisation ID of each text run and records it in the string table.
 *
 * <p>IDs look like {@code <fileId>_<knot>_<stitch>_<suffix>}: every enclosing knot and stitch name
 * followed by an underscore, then a random suffix over {@code [A-Z0-9]}. An ID already present in a
 * tag after the run is kept unless every run is being retagged.
 */
public class LocationIdAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocationIdAllocator.class);

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int MAX_DRAWS = 16;

    private final RandomGenerator random;
    private final int idLength;
    private final boolean retagAll;
    private final StringTable strings;

    public LocationIdAllocator(RandomGenerator random, int idLength, boolean retagAll, StringTable strings) {
        this.random = Objects.requireNonNull(random, "random");
        if (idLength < 1) {
            throw new IllegalArgumentException("idLength must be at least 1");
        }
        this.idLength = idLength;
        this.retagAll = retagAll;
        this.strings = Objects.requireNonNull(strings, "strings");
    }

    public Allocation allocate(TextRun run) {
        Objects.requireNonNull(run, "run");
        Optional<String> existing = existingId(run);
        if (existing.isPresent() && !retagAll) {
            strings.put(existing.get(), run.text());
            return new Allocation(run, existing.get(), Optional.empty());
        }

        String locId = freshId(run);
        PendingEdit edit = new PendingEdit(run.fileName(), run.endLine(), run.endColumn(), locId);
        LOGGER.debug("Allocated {} for {}:{}", locId, run.fileName(), run.endLine());
        strings.put(locId, run.text());
        return new Allocation(run, locId, Optional.of(edit));
    }

    /**
     * ID carried by the first {@code loc:} tag following the run on its line.
     */
    public static Optional<String> existingId(TextRun run) {
        for (String tag : TagRegions.tagsAfter(run.node())) {
            if (tag.startsWith(PendingEdit.LOC_PREFIX)) {
                String id = tag.substring(PendingEdit.LOC_PREFIX.length()).trim();
                return id.isEmpty() ? Optional.empty() : Optional.of(id);
            }
        }
        return Optional.empty();
    }

    public static String scopePrefix(ScriptNode node) {
        StringBuilder prefix = new StringBuilder();
        for (ScriptNode ancestor : node.ancestry()) {
            if (ancestor.kind().isNamedScope()) {
                ancestor.name().ifPresent(name -> prefix.append(name).append('_'));
            }
        }
        return prefix.toString();
    }

    private String freshId(TextRun run) {
        String base = run.fileId() + "_" + scopePrefix(run.node());
        String candidate = base + randomSuffix();
        int draws = 1;
        while (strings.contains(candidate) && draws < MAX_DRAWS) {
            candidate = base + randomSuffix();
            draws++;
        }
        if (strings.contains(candidate)) {
            LOGGER.warn("Could not find an unused ID for {}:{} after {} draws; reusing {}",
                    run.fileName(), run.endLine(), draws, candidate);
        }
        return candidate;
    }

    String randomSuffix() {
        char[] chars = new char[idLength];
        for (int i = 0; i < idLength; i++) {
            chars[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(chars);
    }
}
