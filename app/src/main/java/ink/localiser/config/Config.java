package ink.localiser.config;

import ink.localiser.localise.LocaliserOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path folder,
        String filePattern,
        List<String> files,
        boolean retagAll,
        boolean debugOutput,
        String debugSuffix,
        int idLength,
        Optional<Long> seed,
        boolean stageChanges,
        LogFormat logFormat
) {

    static final int MAX_ID_LENGTH = 32;

    public Config {
        Objects.requireNonNull(folder, "folder");
        filePattern = requireNonBlank(filePattern, "filePattern");
        files = files == null
                ? List.of()
                : files.stream()
                .map(value -> value.replace('\\', '/').trim())
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableList());
        debugSuffix = requireNonBlank(debugSuffix, "debugSuffix");
        if (idLength < 1 || idLength > MAX_ID_LENGTH) {
            throw new IllegalArgumentException("idLength must be between 1 and " + MAX_ID_LENGTH);
        }
        seed = seed == null ? Optional.empty() : seed;
        if (stageChanges && debugOutput) {
            throw new IllegalArgumentException("--stage can only be used together with --no-debug-output");
        }
        logFormat = Objects.requireNonNullElse(logFormat, LogFormat.TEXT);
    }

    public LocaliserOptions localiserOptions() {
        return new LocaliserOptions(retagAll, debugOutput, debugSuffix, idLength);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
