package ink.localiser.script;

import java.util.Objects;

/**
 * Location of a node in its source file.
 *
 * <p>Lines are 1-based. {@code endColumn} is the 0-based offset just past the last character
 * of the node on {@code endLine}, which is where a trailing tag would be inserted.
 */
public record SourcePosition(String fileName, int startLine, int endLine, int endColumn) {

    public SourcePosition {
        Objects.requireNonNull(fileName, "fileName");
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + "-" + endLine);
        }
        if (endColumn < 0) {
            throw new IllegalArgumentException("endColumn must not be negative");
        }
    }

    public static SourcePosition onLine(String fileName, int line, int endColumn) {
        return new SourcePosition(fileName, line, line, endColumn);
    }

    /**
     * File name without directories or extension, used as the leading part of every ID.
     */
    public String fileId() {
        return fileIdOf(fileName);
    }

    public static String fileIdOf(String fileName) {
        String normalized = fileName.replace('\\', '/');
        String baseName = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = baseName.lastIndexOf('.');
        return dot > 0 ? baseName.substring(0, dot) : baseName;
    }
}
