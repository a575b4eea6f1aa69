package com.monitoring.plugin.api;

/**
 * The body of a check: measures something and records results, perfdata and
 * extended data on the plugin it is given.
 */
@FunctionalInterface
public interface Check {

    void execute(MonitoringPlugin plugin) throws Exception;
}
