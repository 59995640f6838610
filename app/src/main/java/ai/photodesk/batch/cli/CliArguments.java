package ai.photodesk.batch.cli;

import ai.photodesk.batch.config.LogFormat;
import ai.photodesk.batch.config.Mode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "photodesk-batch", mixinStandardHelpOptions = true,
        description = "Batch image processor with AI alt text generation")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "INPUT", description = "Image files or folders to process")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--mode", converter = OptionConverters.ModeConverter.class, defaultValue = "process",
            description = "Execution mode: process, validate-key or estimate-cost")
    private Mode mode = Mode.PROCESS;

    @CommandLine.Option(names = "--preset", description = "Output preset: editorial_web, email, instagram_story, instagram_feed_portrait", paramLabel = "NAME")
    private String presetName;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output folder", paramLabel = "DIR")
    private Path outputFolder;

    @CommandLine.Option(names = "--alt-text", description = "Generate alt text for processed images")
    private boolean generateAltText;

    @CommandLine.Option(names = "--context", description = "Editorial context added to the alt text prompt", paramLabel = "TEXT")
    private String context;

    @CommandLine.Option(names = "--filename-template", description = "Output name template, e.g. {original_name}_{date}_{preset}", paramLabel = "TEMPLATE")
    private String filenameTemplate;

    @CommandLine.Option(names = {"-r", "--recursive"}, description = "Scan input folders recursively")
    private boolean recursive;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> inputs() {
        return inputs == null ? List.of() : List.copyOf(inputs);
    }

    public Mode mode() {
        return mode;
    }

    public String presetName() {
        return presetName;
    }

    public Path outputFolder() {
        return outputFolder;
    }

    public boolean generateAltText() {
        return generateAltText;
    }

    public String context() {
        return context;
    }

    public String filenameTemplate() {
        return filenameTemplate;
    }

    public boolean recursive() {
        return recursive;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
