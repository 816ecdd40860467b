package ink.localiser.localise;

/**
 * Reasons a localisation run stops.
 */
public enum FailureKind {
    /** The script parser reported an error; nothing was written. */
    PARSE_FAILURE,
    /** Two localisable runs share a line; nothing was written. */
    CLASSIFICATION_CONFLICT,
    /** Reading or writing a source file failed; earlier files may already be rewritten. */
    FILE_IO_FAILURE
}
