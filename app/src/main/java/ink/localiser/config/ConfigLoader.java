package ink.localiser.config;

import ink.localiser.cli.CliArguments;
import ink.localiser.localise.LocaliserOptions;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_FOLDER = "LOCALISER_FOLDER";
    static final String ENV_FILE_PATTERN = "LOCALISER_FILE_PATTERN";
    static final String ENV_RETAG_ALL = "LOCALISER_RETAG_ALL";
    static final String ENV_DEBUG_OUTPUT = "LOCALISER_DEBUG_OUTPUT";
    static final String ENV_DEBUG_SUFFIX = "LOCALISER_DEBUG_SUFFIX";
    static final String ENV_ID_LENGTH = "LOCALISER_ID_LENGTH";
    static final String ENV_SEED = "LOCALISER_SEED";
    static final String ENV_STAGE = "LOCALISER_STAGE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_FOLDER = ".";
    private static final String DEFAULT_FILE_PATTERN = "**.ink";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path folder = resolveFolder(arguments);
        String filePattern = firstNonBlank(arguments.filePattern(), ENV_FILE_PATTERN, DEFAULT_FILE_PATTERN);
        boolean retagAll = arguments.retagAll() || resolveFlag(ENV_RETAG_ALL, false);
        boolean debugOutput = arguments.debugOutput() != null
                ? arguments.debugOutput()
                : resolveFlag(ENV_DEBUG_OUTPUT, true);
        String debugSuffix = firstNonBlank(arguments.debugSuffix(), ENV_DEBUG_SUFFIX, LocaliserOptions.DEFAULT_DEBUG_SUFFIX);
        int idLength = arguments.idLength() != null
                ? arguments.idLength()
                : environmentReader.value(ENV_ID_LENGTH)
                .map(value -> parseInteger(value, ENV_ID_LENGTH))
                .orElse(LocaliserOptions.DEFAULT_ID_LENGTH);
        Optional<Long> seed = Optional.ofNullable(arguments.seed())
                .or(() -> environmentReader.value(ENV_SEED)
                        .map(value -> parseLong(value, ENV_SEED)));
        boolean stageChanges = arguments.stage() || resolveFlag(ENV_STAGE, false);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(folder, filePattern, arguments.files(), retagAll, debugOutput, debugSuffix,
                idLength, seed, stageChanges, logFormat);
    }

    private Path resolveFolder(CliArguments arguments) {
        String raw = firstNonBlank(arguments.folder(), ENV_FOLDER, DEFAULT_FOLDER);
        try {
            return Path.of(raw);
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException("Invalid source folder: " + raw, ex);
        }
    }

    private boolean resolveFlag(String envKey, boolean defaultValue) {
        return environmentReader.value(envKey)
                .map(value -> parseBoolean(value, envKey))
                .orElse(defaultValue);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.value(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.value(envKey)
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw, String envKey) {
        if (raw.equalsIgnoreCase("true") || raw.equals("1")) {
            return true;
        }
        if (raw.equalsIgnoreCase("false") || raw.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException(envKey + " must be true or false");
    }

    private static int parseInteger(String raw, String envKey) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static long parseLong(String raw, String envKey) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }
}
