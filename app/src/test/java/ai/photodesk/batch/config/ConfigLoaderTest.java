package ai.photodesk.batch.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.photodesk.batch.cli.CliArguments;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--preset", "instagram_story",
                "-o", "out",
                "--alt-text",
                "--context", "Sports desk",
                "--filename-template", "{original_name}_{date}",
                "--recursive",
                "--log-format", "json",
                "photos", "extra.jpg");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.PROCESS);
        assertThat(config.inputs()).containsExactly(Path.of("photos"), Path.of("extra.jpg"));
        assertThat(config.presetName()).isEqualTo("instagram_story");
        assertThat(config.outputFolder()).isEqualTo(Path.of("out"));
        assertThat(config.generateAltText()).isTrue();
        assertThat(config.recursive()).isTrue();
        assertThat(config.filenameTemplate()).contains("{original_name}_{date}");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.altTextSettings().defaultContext()).contains("Sports desk");
        assertThat(config.altTextSettings().hasApiKey()).isFalse();
        assertThat(config.visionConfig().provider()).isEqualTo(VisionProvider.ANTHROPIC);
        assertThat(config.visionConfig().modelName()).isEqualTo(VisionProvider.ANTHROPIC.defaultModel());
    }

    @Test
    void appliesDefaultsWhenNothingIsConfigured() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a.jpg");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.presetName()).isEqualTo(ConfigLoader.DEFAULT_PRESET);
        assertThat(config.outputFolder()).isEqualTo(ConfigLoader.DEFAULT_OUTPUT_FOLDER);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.filenameTemplate()).isEmpty();
        assertThat(config.maxSourceFileBytes()).isEqualTo(15L * 1024 * 1024);
        assertThat(config.altTextSettings().maxConcurrentRequests()).isEqualTo(5);
        assertThat(config.altTextSettings().maxRequestsPerMinute()).isEqualTo(50);
        assertThat(config.altTextSettings().maxRetryAttempts()).isEqualTo(3);
        assertThat(config.altTextSettings().costPerImage()).isEqualByComparingTo("0.006");
        assertThat(config.usageStatsFile()).isPresent();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_ANTHROPIC_API_KEY, " sk-ant ");
        envValues.put(ConfigLoader.ENV_ANTHROPIC_BASE_URL, "http://localhost:8080");
        envValues.put(ConfigLoader.ENV_VISION_MODEL, "claude-custom");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_CONTEXT, "Food section");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_MAX_CONCURRENT, "2");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_MAX_REQUESTS_PER_MINUTE, "10");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_MAX_RETRY_ATTEMPTS, "4");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_INITIAL_BACKOFF_MILLIS, "250");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_MAX_BACKOFF_MILLIS, "5000");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_RETRY_JITTER_FACTOR, "0.1");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_REQUEST_TIMEOUT_SECONDS, "45");
        envValues.put(ConfigLoader.ENV_ALT_TEXT_COST_PER_IMAGE, "0.01");
        envValues.put(ConfigLoader.ENV_MAX_SOURCE_FILE_MB, "20");
        envValues.put(ConfigLoader.ENV_USAGE_STATS_FILE, "/tmp/usage.json");
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a.jpg");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        AltTextSettings settings = config.altTextSettings();
        assertThat(settings.apiKey()).contains("sk-ant");
        assertThat(settings.defaultContext()).contains("Food section");
        assertThat(settings.maxConcurrentRequests()).isEqualTo(2);
        assertThat(settings.maxRequestsPerMinute()).isEqualTo(10);
        assertThat(settings.maxRetryAttempts()).isEqualTo(4);
        assertThat(settings.initialBackoff()).isEqualTo(Duration.ofMillis(250));
        assertThat(settings.maxBackoff()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.jitterFactor()).isEqualTo(0.1);
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(settings.costPerImage()).isEqualByComparingTo(new BigDecimal("0.01"));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.visionConfig().modelName()).isEqualTo("claude-custom");
        assertThat(config.visionConfig().baseUrl()).contains("http://localhost:8080");
        assertThat(config.maxSourceFileBytes()).isEqualTo(20L * 1024 * 1024);
        assertThat(config.usageStatsFile()).contains(Path.of("/tmp/usage.json"));
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_ANTHROPIC_API_KEY);
    }

    @Test
    void cliValuesTakePrecedenceOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LOG_FORMAT, "json",
                ConfigLoader.ENV_ALT_TEXT_CONTEXT, "From env"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--log-format", "text", "--context", "From cli", "a.jpg");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.altTextSettings().defaultContext()).contains("From cli");
    }

    @Test
    void geminiProviderUsesGeminiKey() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_VISION_PROVIDER, "gemini",
                ConfigLoader.ENV_ANTHROPIC_API_KEY, "sk-ant",
                ConfigLoader.ENV_GEMINI_API_KEY, "gm-key",
                ConfigLoader.ENV_ANTHROPIC_BASE_URL, "http://ignored"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--mode", "validate-key");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.VALIDATE_KEY);
        assertThat(config.visionConfig().provider()).isEqualTo(VisionProvider.GEMINI);
        assertThat(config.visionConfig().modelName()).isEqualTo(VisionProvider.GEMINI.defaultModel());
        assertThat(config.visionConfig().baseUrl()).isEmpty();
        assertThat(config.altTextSettings().apiKey()).contains("gm-key");
        assertThat(config.secrets().toString()).doesNotContain("gm-key").doesNotContain("sk-ant");
    }

    @Test
    void usageTrackingCanBeDisabled() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_USAGE_TRACKING_ENABLED, "false"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--mode", "estimate-cost");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.usageStatsFile()).isEmpty();
        assertThat(config.inputs()).isEmpty();
    }

    @Test
    void processModeWithoutInputsThrows() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("input");
    }

    @Test
    void invalidNumericEnvironmentValueThrows() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_ALT_TEXT_MAX_CONCURRENT, "many"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a.jpg");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_ALT_TEXT_MAX_CONCURRENT);
    }

    @Test
    void unknownProviderThrows() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_VISION_PROVIDER, "openai"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a.jpg");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("openai");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
