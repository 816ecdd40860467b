package ink.localiser.patch;

/**
 * How a tag is written into a line.
 */
public enum EditMode {
    INSERT,
    REPLACE;

    /**
     * A line that already mentions a localisation tag gets it replaced; any other line gets a new one.
     */
    public static EditMode detect(String line) {
        return line.contains(PendingEdit.TAG_MARKER + PendingEdit.LOC_PREFIX) ? REPLACE : INSERT;
    }
}
