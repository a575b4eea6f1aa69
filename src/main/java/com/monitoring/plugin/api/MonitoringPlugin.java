package com.monitoring.plugin.api;

import com.monitoring.plugin.core.model.Severity;
import com.monitoring.plugin.extdata.ExtendedDataCollector;
import com.monitoring.plugin.extdata.ExtendedDataSink;
import com.monitoring.plugin.logging.LogContext;
import com.monitoring.plugin.perfdata.PerfDatum;
import com.monitoring.plugin.perfdata.PerformanceDataFormatter;
import com.monitoring.plugin.result.ResultAggregator;
import com.monitoring.plugin.threshold.InvalidThresholdFormatException;
import com.monitoring.plugin.threshold.ThresholdChecker;
import com.monitoring.plugin.threshold.ThresholdRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.Objects;

/**
 * Entry point for writing a check. Owns the results, performance data and extended
 * output of one check execution and turns them into a {@link CheckOutput}.
 *
 * <p>Usage:</p>
 * <pre>
 * MonitoringPlugin plugin = new MonitoringPlugin(PluginConfig.defaults("check_disk"));
 * CheckOutput output = plugin.run(p -&gt; {
 *     double used = measure();
 *     p.addResult(p.checkThreshold(used, "80", "90"), "disk used " + used + "%");
 *     p.addPerfdata(PerfDatum.builder("used", used).unit("%").minimum(0).maximum(100).build());
 * });
 * output.writeTo(System.out);
 * System.exit(output.exitCode());
 * </pre>
 *
 * <p>Not thread-safe: create one instance per check execution.</p>
 */
public class MonitoringPlugin {
    private static final Logger log = LoggerFactory.getLogger(MonitoringPlugin.class);

    private final PluginConfig config;
    private final ResultAggregator results = new ResultAggregator();
    private final PerformanceDataFormatter perfdata = new PerformanceDataFormatter();
    private final ExtendedDataCollector extdata = new ExtendedDataCollector();

    public MonitoringPlugin(PluginConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public PluginConfig getConfig() {
        return config;
    }

    public ResultAggregator getResults() {
        return results;
    }

    public PerformanceDataFormatter getPerfdata() {
        return perfdata;
    }

    public ExtendedDataCollector getExtdata() {
        return extdata;
    }

    /**
     * Sink for log adapters such as {@link com.monitoring.plugin.logging.ExtendedDataAppender}.
     */
    public ExtendedDataSink extendedDataSink() {
        return extdata;
    }

    public void addResult(Severity severity, String message) {
        results.addResult(severity, message);
    }

    public void addPerfdata(PerfDatum datum) {
        perfdata.add(datum);
    }

    public void addPerfdata(String label, Number value, String unit, String warning,
                            String critical, Number minimum, Number maximum) {
        perfdata.addPerfdata(label, value, unit, warning, critical, minimum, maximum);
    }

    public void addPerfdata(String label, Number value, String unit, ThresholdRange warning,
                            ThresholdRange critical, Number minimum, Number maximum) {
        perfdata.addPerfdata(label, value, unit, warning, critical, minimum, maximum);
    }

    public void addPerfdata(String label, Number value, String unit) {
        perfdata.addPerfdata(label, value, unit);
    }

    public void addExtdata(String line) {
        extdata.add(line);
    }

    public Severity checkThreshold(double value, String warning, String critical) {
        return ThresholdChecker.evaluate(value, warning, critical);
    }

    public Severity checkThreshold(double value, ThresholdRange warning, ThresholdRange critical) {
        return ThresholdChecker.evaluate(value, warning, critical);
    }

    /**
     * Builds the output from everything recorded so far: aggregate severity,
     * message of the first result with that severity, perfdata and extended data.
     */
    public CheckOutput finish() {
        return exit(results.code(), results.message(), perfdata.render(), extdata.render());
    }

    /**
     * Builds an output from explicit values, applying the status prefix if configured.
     */
    public CheckOutput exit(Severity severity, String message, String perfdata, String extdata) {
        Objects.requireNonNull(severity, "severity is required");
        String text = message != null ? message : "";
        if (config.statusPrefix()) {
            text = config.name().toUpperCase(Locale.ROOT) + " " + severity.label() + " - " + text;
        }
        CheckOutput output = new CheckOutput(severity, text, perfdata, extdata);
        log.debug("Plugin {} finished with {} ({} results, {} perfdata)",
                config.name(), severity, results.size(), this.perfdata.size());
        return output;
    }

    /**
     * Gives up with UNKNOWN, discarding perfdata and extended data.
     */
    public CheckOutput die(String message) {
        return exit(Severity.UNKNOWN, message, null, null);
    }

    /**
     * Runs the check body and finishes. Failures never escape as exceptions:
     * a malformed threshold or any other exception becomes an UNKNOWN output.
     * An interrupted check keeps the thread's interrupt status set.
     */
    public CheckOutput run(Check check) {
        Objects.requireNonNull(check, "check is required");
        try (LogContext ctx = LogContext.forCheck(config.name(), LogContext.generateCheckId())) {
            try {
                check.execute(this);
                return finish();
            } catch (InvalidThresholdFormatException e) {
                log.warn("Plugin {} has an invalid threshold: {}", config.name(), e.getMessage());
                return exit(Severity.UNKNOWN, "Invalid threshold: " + e.getMessage(), null, null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Plugin {} was interrupted", config.name());
                String reason = e.getMessage() != null ? ": " + e.getMessage() : "";
                return exit(Severity.UNKNOWN, "Check interrupted" + reason, null, null);
            } catch (Exception e) {
                log.warn("Plugin {} failed with {}", config.name(), e.getClass().getSimpleName(), e);
                return exit(Severity.UNKNOWN,
                        "Uncaught exception: " + e.getClass().getSimpleName() + " - " + e.getMessage(),
                        null, stackTrace(e));
            }
        }
    }

    private static String stackTrace(Throwable e) {
        StringWriter writer = new StringWriter();
        e.printStackTrace(new PrintWriter(writer));
        return writer.toString().stripTrailing();
    }
}
