package com.deda.plugin;

import com.deda.config.EffectiveConfig;
import com.deda.config.LayeredConfig;
import com.deda.config.ProjectConfig;
import com.deda.config.ResolvedSetting;
import com.deda.config.ServiceConfig;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * What a plugin sees when it loads: its own id, the effective configuration at load time (including
 * the site's service endpoints) and the root of the current project (if any).
 */
public final class PluginContext {

    private final PluginId pluginId;
    private final EffectiveConfig config;
    private final Path projectRoot;

    public PluginContext(PluginId pluginId, EffectiveConfig config, Path projectRoot) {
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.config = config != null ? config : EffectiveConfig.empty();
        this.projectRoot = projectRoot;
    }

    /** Context reflecting the current state of {@code config}. */
    public static PluginContext of(PluginId pluginId, LayeredConfig config) {
        Path root = config.currentProject().map(ProjectConfig::getRootPath).orElse(null);
        return new PluginContext(pluginId, config.effective(), root);
    }

    /** Context with no configuration and no project. */
    public static PluginContext standalone(PluginId pluginId) {
        return new PluginContext(pluginId, EffectiveConfig.empty(), null);
    }

    public PluginId getPluginId() {
        return pluginId;
    }

    public EffectiveConfig getConfig() {
        return config;
    }

    public ResolvedSetting getSetting(String key) {
        return config.get(key);
    }

    /** Enabled site service with the given name, e.g. the task tracker a plugin talks to. */
    public Optional<ServiceConfig> getService(String name) {
        return config.findService(name).filter(ServiceConfig::isEnabled);
    }

    public Optional<Path> getProjectRoot() {
        return Optional.ofNullable(projectRoot);
    }
}
