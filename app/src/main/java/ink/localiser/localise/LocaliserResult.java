package ink.localiser.localise;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a localisation run. The string table holds whatever was collected before a failure.
 */
public record LocaliserResult(Optional<FailureKind> failureKind,
                              String message,
                              StringTable strings,
                              List<Path> writtenFiles) {

    public LocaliserResult {
        failureKind = failureKind == null ? Optional.empty() : failureKind;
        message = Objects.requireNonNullElse(message, "");
        strings = Objects.requireNonNull(strings, "strings");
        writtenFiles = List.copyOf(writtenFiles == null ? List.of() : writtenFiles);
    }

    public static LocaliserResult succeeded(StringTable strings, List<Path> writtenFiles) {
        return new LocaliserResult(Optional.empty(), "", strings, writtenFiles);
    }

    public static LocaliserResult failed(FailureKind kind, String message, StringTable strings, List<Path> writtenFiles) {
        return new LocaliserResult(Optional.of(kind), message, strings, writtenFiles);
    }

    public boolean success() {
        return failureKind.isEmpty();
    }
}
