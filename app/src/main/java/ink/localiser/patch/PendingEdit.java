package ink.localiser.patch;

import java.util.Objects;

/**
 * A localisation tag that still has to be written into a source line.
 *
 * <p>{@code lineNumber} is 1-based and {@code insertColumn} is the 0-based column where the tag goes
 * when the line does not carry one yet.
 */
public record PendingEdit(String fileName, int lineNumber, int insertColumn, String locId) {

    public static final String TAG_MARKER = "#";
    public static final String LOC_PREFIX = "loc:";

    public PendingEdit {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(locId, "locId");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be 1 or greater");
        }
        if (insertColumn < 0) {
            throw new IllegalArgumentException("insertColumn must not be negative");
        }
    }

    public String tagText() {
        return TAG_MARKER + LOC_PREFIX + locId;
    }
}
