package com.monitoring.plugin.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import ch.qos.logback.core.Layout;
import com.monitoring.plugin.extdata.ExtendedDataSink;

import java.util.Objects;

/**
 * Logback appender that forwards every log record to an {@link ExtendedDataSink},
 * so diagnostics logged during a check end up in the plugin's extended output.
 *
 * <p>Each record produces exactly one {@code add} call. With a {@link Layout} the
 * layout output is used (trailing line separators removed); otherwise the
 * record's formatted message.</p>
 *
 * <pre>
 * ExtendedDataAppender appender = new ExtendedDataAppender(plugin.extendedDataSink());
 * appender.setContext(loggerContext);
 * appender.start();
 * loggerContext.getLogger("com.acme.check").addAppender(appender);
 * </pre>
 */
public class ExtendedDataAppender extends AppenderBase<ILoggingEvent> {

    private final ExtendedDataSink sink;
    private Layout<ILoggingEvent> layout;

    public ExtendedDataAppender(ExtendedDataSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink is required");
        setName("EXTDATA");
    }

    public void setLayout(Layout<ILoggingEvent> layout) {
        this.layout = layout;
    }

    public Layout<ILoggingEvent> getLayout() {
        return layout;
    }

    @Override
    protected void append(ILoggingEvent event) {
        String line = layout != null ? stripTrailingNewlines(layout.doLayout(event)) : event.getFormattedMessage();
        sink.add(line != null ? line : "");
    }

    private static String stripTrailingNewlines(String text) {
        if (text == null) {
            return null;
        }
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
