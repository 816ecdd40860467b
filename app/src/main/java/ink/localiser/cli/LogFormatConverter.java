package ink.localiser.cli;

import ink.localiser.config.LogFormat;
import picocli.CommandLine;

/**
 * Converts {@code --log-format} values, reporting unknown ones as usage errors.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("expected text or json but was '" + value + "'");
        }
    }
}
