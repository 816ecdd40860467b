package ink.localiser.localise;

import java.util.Objects;

/**
 * Switches controlling how IDs are assigned and where rewritten scripts go.
 *
 * @param retagAll     give every run a fresh ID even when it already has one
 * @param debugOutput  write {@code <file><debugSuffix>} next to each script instead of overwriting it
 * @param debugSuffix  suffix appended to the file name in debug output mode
 * @param idLength     number of random characters at the end of each ID
 */
public record LocaliserOptions(boolean retagAll, boolean debugOutput, String debugSuffix, int idLength) {

    public static final String DEFAULT_DEBUG_SUFFIX = ".txt";
    public static final int DEFAULT_ID_LENGTH = 4;

    public LocaliserOptions {
        debugSuffix = Objects.requireNonNullElse(debugSuffix, DEFAULT_DEBUG_SUFFIX);
        if (debugOutput && debugSuffix.isBlank()) {
            throw new IllegalArgumentException("debugSuffix must not be blank");
        }
        if (idLength < 1) {
            throw new IllegalArgumentException("idLength must be at least 1");
        }
    }

    public static LocaliserOptions defaults() {
        return new LocaliserOptions(false, true, DEFAULT_DEBUG_SUFFIX, DEFAULT_ID_LENGTH);
    }

    public LocaliserOptions withRetagAll(boolean value) {
        return new LocaliserOptions(value, debugOutput, debugSuffix, idLength);
    }

    public LocaliserOptions withDebugOutput(boolean value) {
        return new LocaliserOptions(retagAll, value, debugSuffix, idLength);
    }
}
