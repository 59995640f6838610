package ai.photodesk.batch.config;

import ai.photodesk.batch.cli.CliArguments;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 * CLI values take precedence over environment values.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VISION_PROVIDER = "VISION_PROVIDER";
    static final String ENV_VISION_MODEL = "VISION_MODEL";
    static final String ENV_ANTHROPIC_BASE_URL = "ANTHROPIC_BASE_URL";
    static final String ENV_ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_ALT_TEXT_CONTEXT = "ALT_TEXT_CONTEXT";
    static final String ENV_ALT_TEXT_MAX_CONCURRENT = "ALT_TEXT_MAX_CONCURRENT";
    static final String ENV_ALT_TEXT_MAX_REQUESTS_PER_MINUTE = "ALT_TEXT_MAX_REQUESTS_PER_MINUTE";
    static final String ENV_ALT_TEXT_MAX_RETRY_ATTEMPTS = "ALT_TEXT_MAX_RETRY_ATTEMPTS";
    static final String ENV_ALT_TEXT_INITIAL_BACKOFF_MILLIS = "ALT_TEXT_INITIAL_BACKOFF_MILLIS";
    static final String ENV_ALT_TEXT_MAX_BACKOFF_MILLIS = "ALT_TEXT_MAX_BACKOFF_MILLIS";
    static final String ENV_ALT_TEXT_RETRY_JITTER_FACTOR = "ALT_TEXT_RETRY_JITTER_FACTOR";
    static final String ENV_ALT_TEXT_REQUEST_TIMEOUT_SECONDS = "ALT_TEXT_REQUEST_TIMEOUT_SECONDS";
    static final String ENV_ALT_TEXT_COST_PER_IMAGE = "ALT_TEXT_COST_PER_IMAGE";
    static final String ENV_MAX_SOURCE_FILE_MB = "MAX_SOURCE_FILE_MB";
    static final String ENV_USAGE_STATS_FILE = "USAGE_STATS_FILE";
    static final String ENV_USAGE_TRACKING_ENABLED = "USAGE_TRACKING_ENABLED";

    static final String DEFAULT_PRESET = "editorial_web";
    static final Path DEFAULT_OUTPUT_FOLDER = Path.of("processed");
    private static final int DEFAULT_MAX_SOURCE_FILE_MB = 15;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = arguments.mode() == null ? Mode.PROCESS : arguments.mode();
        LogFormat logFormat = resolveLogFormat(arguments);

        VisionProvider provider = env(ENV_VISION_PROVIDER)
                .map(VisionProvider::from)
                .orElse(VisionProvider.ANTHROPIC);
        String modelName = env(ENV_VISION_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = provider == VisionProvider.ANTHROPIC ? env(ENV_ANTHROPIC_BASE_URL) : Optional.empty();
        VisionConfig visionConfig = new VisionConfig(provider, modelName, baseUrl);

        Secrets secrets = new Secrets(env(ENV_ANTHROPIC_API_KEY), env(ENV_GEMINI_API_KEY));

        Optional<String> context = Optional.ofNullable(arguments.context())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> env(ENV_ALT_TEXT_CONTEXT));

        AltTextSettings altTextSettings = new AltTextSettings(
                secrets.apiKeyFor(provider),
                context,
                intValue(ENV_ALT_TEXT_MAX_CONCURRENT, AltTextSettings.DEFAULT_MAX_CONCURRENT_REQUESTS),
                intValue(ENV_ALT_TEXT_MAX_REQUESTS_PER_MINUTE, AltTextSettings.DEFAULT_MAX_REQUESTS_PER_MINUTE),
                intValue(ENV_ALT_TEXT_MAX_RETRY_ATTEMPTS, AltTextSettings.DEFAULT_MAX_RETRY_ATTEMPTS),
                Duration.ofMillis(intValue(ENV_ALT_TEXT_INITIAL_BACKOFF_MILLIS, (int) AltTextSettings.DEFAULT_INITIAL_BACKOFF.toMillis())),
                Duration.ofMillis(intValue(ENV_ALT_TEXT_MAX_BACKOFF_MILLIS, (int) AltTextSettings.DEFAULT_MAX_BACKOFF.toMillis())),
                env(ENV_ALT_TEXT_RETRY_JITTER_FACTOR).map(ConfigLoader::parseDouble).orElse(AltTextSettings.DEFAULT_JITTER_FACTOR),
                Duration.ofSeconds(intValue(ENV_ALT_TEXT_REQUEST_TIMEOUT_SECONDS, (int) AltTextSettings.DEFAULT_REQUEST_TIMEOUT.toSeconds())),
                env(ENV_ALT_TEXT_COST_PER_IMAGE).map(ConfigLoader::parseDecimal).orElse(AltTextSettings.DEFAULT_COST_PER_IMAGE));

        long maxSourceFileBytes = (long) intValue(ENV_MAX_SOURCE_FILE_MB, DEFAULT_MAX_SOURCE_FILE_MB) * 1024L * 1024L;
        Optional<Path> usageStatsFile = resolveUsageStatsFile();

        String presetName = firstNonBlank(arguments.presetName(), DEFAULT_PRESET);
        Path outputFolder = arguments.outputFolder() == null ? DEFAULT_OUTPUT_FOLDER : arguments.outputFolder();

        return new Config(mode, arguments.inputs(), arguments.recursive(), presetName, outputFolder,
                arguments.generateAltText(), Optional.ofNullable(arguments.filenameTemplate()), logFormat,
                visionConfig, secrets, altTextSettings, maxSourceFileBytes, usageStatsFile);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> resolveUsageStatsFile() {
        boolean enabled = env(ENV_USAGE_TRACKING_ENABLED)
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .map(value -> value.equals("true") || value.equals("1"))
                .orElse(true);
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.of(env(ENV_USAGE_STATS_FILE)
                .map(Path::of)
                .orElseGet(() -> Path.of(System.getProperty("user.home"), ".photodesk", "usage-stats.json")));
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private int intValue(String key, int defaultValue) {
        return env(key)
                .map(raw -> parseNonNegativeInteger(key, raw))
                .orElse(defaultValue);
    }

    private static String firstNonBlank(String cliValue, String defaultValue) {
        return isNotBlank(cliValue) ? cliValue.trim() : defaultValue;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseNonNegativeInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }

    private static BigDecimal parseDecimal(String raw) {
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid decimal value: " + raw, ex);
        }
    }
}
