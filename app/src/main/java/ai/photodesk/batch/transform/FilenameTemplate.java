package ai.photodesk.batch.transform;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands output file name templates such as {@code {original_name}_{date}_{preset}}.
 *
 * <p>Supported variables: {@code {original_name}}, {@code {original_ext}}, {@code {preset}}, {@code {date}},
 * {@code {time}}, {@code {year}}, {@code {month}}, {@code {day}}, {@code {counter}} and {@code {counter:NN}}
 * (zero padded to NN digits). The counter advances once per rendered name. Unknown variables are left as is.
 */
public class FilenameTemplate {

    public static final String DEFAULT_TEMPLATE = "{original_name}_{preset}";

    private static final Pattern COUNTER_PATTERN = Pattern.compile("\\{counter(?::(\\d+))?}");
    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[<>:\"|?*/\\\\]");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH-mm-ss");

    private final String template;
    private final Clock clock;
    private int counterStart = 1;
    private int rendered;

    public FilenameTemplate(String template) {
        this(template, Clock.systemDefaultZone());
    }

    public FilenameTemplate(String template, Clock clock) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("template must not be blank");
        }
        this.template = template;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String template() {
        return template;
    }

    public void resetCounter(int start) {
        this.counterStart = start;
        this.rendered = 0;
    }

    /**
     * Renders the template for one source file and appends the preset's output extension.
     */
    public String render(Path source, Preset preset) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(preset, "preset");
        int counter = counterStart + rendered;
        rendered++;

        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, String> values = Map.of(
                "{original_name}", SupportedImageTypes.stemOf(source),
                "{original_ext}", SupportedImageTypes.extensionOf(source),
                "{preset}", preset.key(),
                "{date}", DATE.format(now),
                "{time}", TIME.format(now),
                "{year}", String.format("%04d", now.getYear()),
                "{month}", String.format("%02d", now.getMonthValue()),
                "{day}", String.format("%02d", now.getDayOfMonth()));

        Matcher matcher = COUNTER_PATTERN.matcher(template);
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String padding = matcher.group(1);
            String replacement = padding == null
                    ? Integer.toString(counter)
                    : String.format("%0" + Integer.parseInt(padding) + "d", counter);
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(expanded);

        String name = expanded.toString();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            name = name.replace(entry.getKey(), entry.getValue());
        }
        return sanitize(name) + "." + preset.format().extension();
    }

    /**
     * Replaces characters that are not portable in file names and trims leading or trailing dots and spaces.
     */
    public static String sanitize(String name) {
        String cleaned = INVALID_CHARACTERS.matcher(name == null ? "" : name).replaceAll("_");
        int start = 0;
        int end = cleaned.length();
        while (start < end && isTrimmable(cleaned.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(cleaned.charAt(end - 1))) {
            end--;
        }
        String trimmed = cleaned.substring(start, end);
        return trimmed.isEmpty() ? "unnamed" : trimmed;
    }

    private static boolean isTrimmable(char c) {
        return c == '.' || c == ' ';
    }
}
