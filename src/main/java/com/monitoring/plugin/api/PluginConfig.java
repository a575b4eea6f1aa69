package com.monitoring.plugin.api;

/**
 * Configuration for a monitoring plugin.
 *
 * @param name         plugin name, shown upper-cased in the status prefix
 * @param version      plugin version, {@code "undefined"} when not given
 * @param statusPrefix whether summaries start with {@code "NAME STATUS - "}
 */
public record PluginConfig(String name, String version, boolean statusPrefix) {

    public static final String UNDEFINED_VERSION = "undefined";

    public PluginConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        version = version != null ? version : UNDEFINED_VERSION;
    }

    /**
     * Default configuration: undefined version, no status prefix.
     */
    public static PluginConfig defaults(String name) {
        return new PluginConfig(name, UNDEFINED_VERSION, false);
    }

    /**
     * Returns a copy of this configuration with the {@code "NAME STATUS - "} prefix enabled.
     */
    public PluginConfig withStatusPrefix() {
        return new PluginConfig(name, version, true);
    }

    /**
     * Returns {@code "<name> <version>"}, as printed for a version request.
     */
    public String versionLine() {
        return name + " " + version;
    }
}
