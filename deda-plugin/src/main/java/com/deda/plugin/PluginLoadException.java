package com.deda.plugin;

/**
 * Why a plugin failed to load. Recorded on the {@link PluginDescriptor}; the registry never throws it
 * out of {@link PluginRegistry#load(PluginDescriptor)}.
 */
public final class PluginLoadException extends RuntimeException {

    private final PluginId pluginId;

    public PluginLoadException(PluginId pluginId, String message, Throwable cause) {
        super(message, cause);
        this.pluginId = pluginId;
    }

    public PluginId getPluginId() {
        return pluginId;
    }
}
