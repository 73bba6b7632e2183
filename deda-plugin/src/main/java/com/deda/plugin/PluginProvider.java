package com.deda.plugin;

import java.util.Set;

/**
 * SPI for plugins. Built-in providers are listed by the host; external ones are discovered via
 * {@link java.util.ServiceLoader} (META-INF/services/com.deda.plugin.PluginProvider) in jars on the
 * plugin search paths. No host code changes are required for new plugins.
 * <p>
 * A provider only describes the plugin; {@link #createPlugin()} is not called until the registry
 * loads it, so discovery stays cheap and a broken backend does not affect discovery.
 */
public interface PluginProvider {

    /** Plugin name (e.g. "Shell", "LocalFiles"). Matched against plugin references in configuration. */
    String getName();

    /** Plugin version (e.g. "0.1.0"). Together with the name this is the registry key. */
    default String getVersion() {
        return "1.0";
    }

    default String getVendor() {
        return "";
    }

    default String getDescription() {
        return "";
    }

    /** Capabilities the created plugin implements; checked against its contracts at load. */
    Set<Capability> getCapabilities();

    /**
     * Creates the plugin instance. Called once per load.
     */
    Plugin createPlugin();

    /**
     * Whether this provider should be registered. Override to skip registration on unsupported platforms.
     */
    default boolean isEnabled() {
        return true;
    }
}
