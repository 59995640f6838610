package ai.photodesk.batch.cli;

import ai.photodesk.batch.config.LogFormat;
import ai.photodesk.batch.config.Mode;
import java.util.function.Function;
import picocli.CommandLine;

/**
 * picocli converters for the enum-valued options, reporting bad values as usage errors.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static final class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return parse(value, Mode::from, "process, validate-key, estimate-cost");
        }
    }

    public static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return parse(value, LogFormat::from, "text, json");
        }
    }

    private static <T> T parse(String value, Function<String, T> parser, String accepted) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("'" + value + "' is not one of: " + accepted);
        }
    }
}
