package com.monitoring.plugin.api;

import com.monitoring.plugin.core.model.Severity;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Final output of a check: what the plugin prints and the status it exits with.
 *
 * <p>Rendered as {@code <message>[ | <perfdata>]} followed, when present, by the
 * extended output on the next lines, unmodified.</p>
 *
 * @param severity the final severity, mapped 1:1 to the exit status
 * @param message  the summary message
 * @param perfdata rendered performance data, empty when none
 * @param extdata  rendered extended output, empty when none
 */
public record CheckOutput(Severity severity, String message, String perfdata, String extdata) {

    public CheckOutput {
        Objects.requireNonNull(severity, "severity is required");
        message = message != null ? message : "";
        perfdata = perfdata != null ? perfdata : "";
        extdata = extdata != null ? extdata : "";
    }

    public int exitCode() {
        return severity.exitCode();
    }

    /**
     * The first output line: the message, then {@code " | "} and the perfdata if any.
     */
    public String summaryLine() {
        return perfdata.isEmpty() ? message : message + " | " + perfdata;
    }

    /**
     * The complete plugin output without a trailing line break.
     */
    public String render() {
        return extdata.isEmpty() ? summaryLine() : summaryLine() + "\n" + extdata;
    }

    /**
     * Prints the rendered output, one {@code println} per output block.
     */
    public void writeTo(PrintStream out) {
        out.println(summaryLine());
        if (!extdata.isEmpty()) {
            out.println(extdata);
        }
    }
}
