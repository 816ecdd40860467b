package ink.localiser.patch;

import ink.localiser.script.SourceFileHandler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes localisation tags into source files.
 *
 * <p>Edits are applied against the original column numbers, which is only sound because the
 * classifier allows a single localisable run per line. Files are handled one after another and
 * the first failure stops the whole pass; files written before it stay written.
 */
public class PatchApplier {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatchApplier.class);
    private static final Pattern LOC_TAG = Pattern.compile(
            Pattern.quote(PendingEdit.TAG_MARKER + PendingEdit.LOC_PREFIX) + "\\w+");

    private final SourceFileHandler fileHandler;
    private final boolean debugOutput;
    private final String debugSuffix;
    private final GitStager gitStager;

    public PatchApplier(SourceFileHandler fileHandler, boolean debugOutput, String debugSuffix) {
        this(fileHandler, debugOutput, debugSuffix, null);
    }

    /**
     * @param gitStager stages overwritten originals; ignored in debug output mode, may be null
     */
    public PatchApplier(SourceFileHandler fileHandler, boolean debugOutput, String debugSuffix, GitStager gitStager) {
        this.fileHandler = Objects.requireNonNull(fileHandler, "fileHandler");
        this.debugOutput = debugOutput;
        this.debugSuffix = Objects.requireNonNull(debugSuffix, "debugSuffix");
        if (debugOutput && debugSuffix.isEmpty()) {
            throw new IllegalArgumentException("debugSuffix must not be empty when debug output is enabled");
        }
        this.gitStager = gitStager;
    }

    public PatchOutcome apply(List<FilePatch> patches) {
        List<Path> written = new ArrayList<>();
        for (FilePatch patch : patches) {
            if (patch.edits().isEmpty()) {
                continue;
            }
            try (MDC.MDCCloseable ignored = MDC.putCloseable("file", patch.fileName())) {
                LOGGER.info("Updating IDs in file: {}", patch.fileName());
                FileResult result = applyToFile(patch);
                if (result.failure().isPresent()) {
                    String reason = result.failure().get();
                    LOGGER.error("Error replacing tags in {}: {}", patch.fileName(), reason);
                    return PatchOutcome.failed(written, patch.fileName(), reason);
                }
                written.add(result.target());
            }
        }
        return PatchOutcome.completed(written);
    }

    FileResult applyToFile(FilePatch patch) {
        Path source = fileHandler.resolve(patch.fileName());
        List<String> lines;
        try {
            lines = new ArrayList<>(Files.readAllLines(source, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            return FileResult.failed(source, "could not read " + source + ": " + ex.getMessage());
        }

        for (PendingEdit edit : patch.edits()) {
            int index = edit.lineNumber() - 1;
            if (index >= lines.size()) {
                return FileResult.failed(source, "line " + edit.lineNumber() + " is past the end of the file");
            }
            Optional<String> updated = applyEdit(lines.get(index), edit);
            if (updated.isEmpty()) {
                return FileResult.failed(source, "could not place tag " + edit.tagText() + " on line " + edit.lineNumber());
            }
            lines.set(index, updated.get());
        }

        Path target = debugOutput ? source.resolveSibling(source.getFileName() + debugSuffix) : source;
        try {
            Files.writeString(target, String.join("\n", lines), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return FileResult.failed(target, "could not write " + target + ": " + ex.getMessage());
        }
        if (!debugOutput && gitStager != null) {
            try {
                gitStager.stage(target);
            } catch (IOException ex) {
                return FileResult.failed(target, ex.getMessage());
            }
        }
        return FileResult.written(target);
    }

    /**
     * Rewrites one line. Returns empty when the edit does not fit the line.
     */
    static Optional<String> applyEdit(String line, PendingEdit edit) {
        return switch (EditMode.detect(line)) {
            case REPLACE -> replaceTag(line, edit);
            case INSERT -> insertTag(line, edit);
        };
    }

    private static Optional<String> replaceTag(String line, PendingEdit edit) {
        Matcher matcher = LOC_TAG.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(line.substring(0, matcher.start()) + edit.tagText() + line.substring(matcher.end()));
    }

    private static Optional<String> insertTag(String line, PendingEdit edit) {
        int column = edit.insertColumn();
        if (column > line.length()) {
            return Optional.empty();
        }
        String tag = edit.tagText();
        if (column > 0 && !Character.isWhitespace(line.charAt(column - 1))) {
            tag = " " + tag;
        }
        if (column < line.length() && line.startsWith(PendingEdit.TAG_MARKER, column)) {
            tag = tag + " ";
        }
        return Optional.of(line.substring(0, column) + tag + line.substring(column));
    }

    record FileResult(Path target, Optional<String> failure) {

        static FileResult written(Path target) {
            return new FileResult(target, Optional.empty());
        }

        static FileResult failed(Path target, String reason) {
            return new FileResult(target, Optional.of(reason));
        }
    }
}
