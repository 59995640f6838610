package ai.photodesk.batch.cli;

import ai.photodesk.batch.alttext.AltTextGenerationEngine;
import ai.photodesk.batch.alttext.ApiKeyValidation;
import ai.photodesk.batch.alttext.ImageEncoder;
import ai.photodesk.batch.alttext.client.VisionApiException;
import ai.photodesk.batch.alttext.client.VisionClient;
import ai.photodesk.batch.alttext.client.VisionClientFactory;
import ai.photodesk.batch.alttext.client.VisionFailure;
import ai.photodesk.batch.config.AltTextSettings;
import ai.photodesk.batch.config.Config;
import ai.photodesk.batch.config.ConfigLoader;
import ai.photodesk.batch.config.SystemEnvironmentReader;
import ai.photodesk.batch.logging.LoggingConfigurator;
import ai.photodesk.batch.queue.BatchProcessor;
import ai.photodesk.batch.queue.BatchResult;
import ai.photodesk.batch.throttle.SemaphoreConcurrencyGate;
import ai.photodesk.batch.throttle.SlidingWindowRateLimiter;
import ai.photodesk.batch.transform.ThumbnailatorImageTransformer;
import ai.photodesk.batch.usage.JsonFileUsageTracker;
import ai.photodesk.batch.usage.UsageTracker;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, batch processor and alt-text engine.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private static final VisionClient UNCONFIGURED_CLIENT = request -> {
        throw new VisionApiException(VisionFailure.AUTHENTICATION, "API key not configured");
    };

    private final ConfigLoader configLoader;
    private final Function<Config, VisionClient> visionClientFactory;
    private final PrintStream out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createVisionClient, System.out);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, VisionClient> visionClientFactory, PrintStream out) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.visionClientFactory = Objects.requireNonNull(visionClientFactory, "visionClientFactory");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println("Invalid configuration: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode with {} via {} (alt text key configured: {})", config.mode(),
                config.presetName(), config.visionConfig().provider(), config.altTextSettings().hasApiKey());

        AltTextGenerationEngine engine = createEngine(config);
        BatchReportPrinter printer = new BatchReportPrinter(out);
        return switch (config.mode()) {
            case VALIDATE_KEY -> validateKey(engine, printer);
            case ESTIMATE_COST -> estimateCost(config, engine, printer);
            case PROCESS -> process(config, engine, printer);
        };
    }

    private int validateKey(AltTextGenerationEngine engine, BatchReportPrinter printer) {
        ApiKeyValidation validation = engine.validateApiKey();
        printer.printValidation(validation);
        return validation.valid() ? EXIT_OK : EXIT_FAILED;
    }

    private int estimateCost(Config config, AltTextGenerationEngine engine, BatchReportPrinter printer) {
        BatchProcessor processor = createProcessor(config, engine);
        enqueueInputs(config, processor);
        printer.printCostEstimate(engine.estimateBatchCost(processor.queueSize()));
        return EXIT_OK;
    }

    private int process(Config config, AltTextGenerationEngine engine, BatchReportPrinter printer) {
        BatchProcessor processor = createProcessor(config, engine);
        processor.addObserver(new LoggingBatchObserver());
        int queued = enqueueInputs(config, processor);
        LOGGER.info("Queued {} images", queued);

        Thread shutdownHook = new Thread(() -> cancelAndAwait(processor), "photodesk-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        BatchResult result;
        try {
            String template = config.filenameTemplate().orElse(null);
            result = config.generateAltText()
                    ? processor.processBatchWithAltText(config.presetName(), config.outputFolder(),
                            config.altTextSettings().defaultContext().orElse(null), template)
                    : processor.processBatch(config.presetName(), config.outputFolder(), template);
        } finally {
            removeShutdownHook(shutdownHook);
        }
        printer.printResult(result, processor.items());
        return result.success() ? EXIT_OK : EXIT_FAILED;
    }

    private int enqueueInputs(Config config, BatchProcessor processor) {
        int added = 0;
        for (Path input : config.inputs()) {
            if (Files.isDirectory(input)) {
                added += processor.addFolder(input, config.recursive());
            } else if (processor.addImage(input)) {
                added++;
            }
        }
        return added;
    }

    private BatchProcessor createProcessor(Config config, AltTextGenerationEngine engine) {
        long maxSourceFileBytes = config.maxSourceFileBytes();
        return new BatchProcessor(() -> new ThumbnailatorImageTransformer(maxSourceFileBytes), engine);
    }

    private AltTextGenerationEngine createEngine(Config config) {
        AltTextSettings settings = config.altTextSettings();
        VisionClient client = settings.hasApiKey() ? visionClientFactory.apply(config) : UNCONFIGURED_CLIENT;
        UsageTracker usageTracker = config.usageStatsFile()
                .<UsageTracker>map(JsonFileUsageTracker::new)
                .orElse(UsageTracker.NOOP);
        return new AltTextGenerationEngine(settings, client,
                new SlidingWindowRateLimiter(settings.maxRequestsPerMinute()),
                new SemaphoreConcurrencyGate(settings.maxConcurrentRequests()),
                usageTracker, new ImageEncoder());
    }

    private static VisionClient createVisionClient(Config config) {
        AltTextSettings settings = config.altTextSettings();
        String apiKey = settings.apiKey()
                .orElseThrow(() -> new IllegalStateException("An API key is required for " + config.visionConfig().provider()));
        return VisionClientFactory.create(config.visionConfig(), apiKey, settings.requestTimeout());
    }

    private static void cancelAndAwait(BatchProcessor processor) {
        if (!processor.isProcessing()) {
            return;
        }
        processor.cancelProcessing();
        long deadline = System.nanoTime() + SHUTDOWN_GRACE.toNanos();
        while (processor.isProcessing() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(100L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM already shutting down; shutdown hook stays registered");
        }
    }
}
