package ink.localiser.patch;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Files written by the applier and, when it stopped early, the file and reason.
 */
public record PatchOutcome(List<Path> writtenFiles, Optional<String> failedFile, Optional<String> failure) {

    public PatchOutcome {
        writtenFiles = List.copyOf(writtenFiles == null ? List.of() : writtenFiles);
        failedFile = failedFile == null ? Optional.empty() : failedFile;
        failure = failure == null ? Optional.empty() : failure;
    }

    public static PatchOutcome completed(List<Path> writtenFiles) {
        return new PatchOutcome(writtenFiles, Optional.empty(), Optional.empty());
    }

    public static PatchOutcome failed(List<Path> writtenFiles, String fileName, String reason) {
        return new PatchOutcome(writtenFiles, Optional.of(fileName), Optional.of(reason));
    }

    public boolean isSuccess() {
        return failure.isEmpty();
    }
}
