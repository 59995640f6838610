package ai.photodesk.batch.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * One JSON object per line. MDC entries become top-level fields, so the current batch item shows up as
 * {@code "item"}; a logged exception is reduced to its class and message.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        appendField(builder, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        appendField(builder, "level", String.valueOf(event.getLevel()));
        appendField(builder, "logger", event.getLoggerName());
        appendField(builder, "thread", event.getThreadName());
        for (Map.Entry<String, String> entry : sortedMdc(event).entrySet()) {
            appendField(builder, entry.getKey(), entry.getValue());
        }
        appendField(builder, "message", event.getFormattedMessage());
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            String message = throwable.getMessage();
            appendField(builder, "error", message == null
                    ? throwable.getClassName()
                    : throwable.getClassName() + ": " + message);
        }
        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private void appendField(StringBuilder builder, String name, String value) {
        if (builder.length() > 1) {
            builder.append(',');
        }
        builder.append(quote(name)).append(':').append(quote(value));
    }

    private Map<String, String> sortedMdc(ILoggingEvent event) {
        Map<String, String> map;
        try {
            map = event.getMDCPropertyMap();
        } catch (RuntimeException ex) {
            // events built outside a started context have no MDC adapter
            return Map.of();
        }
        return map == null || map.isEmpty() ? Map.of() : new TreeMap<>(map);
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }
}
