package ink.localiser.script;

/**
 * Closed set of node variants produced by the script parser.
 */
public enum NodeKind {
    STORY,
    KNOT,
    STITCH,
    LINE,
    TEXT,
    TAG_START,
    TAG_END,
    VARIABLE_ASSIGNMENT,
    STRING_EXPRESSION,
    INLINE_EXPRESSION,
    DIVERT;

    /**
     * Named structural containers whose names make up a localisation scope prefix.
     */
    public boolean isNamedScope() {
        return switch (this) {
            case KNOT, STITCH -> true;
            default -> false;
        };
    }

    /**
     * Contexts that evaluate code, where no tag can be attached to a text run.
     */
    public boolean isCodeContext() {
        return switch (this) {
            case VARIABLE_ASSIGNMENT, STRING_EXPRESSION -> true;
            default -> false;
        };
    }

    public boolean isTagMarker() {
        return switch (this) {
            case TAG_START, TAG_END -> true;
            default -> false;
        };
    }
}
