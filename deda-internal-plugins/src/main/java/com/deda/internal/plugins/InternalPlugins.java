package com.deda.internal.plugins;

import com.deda.config.LayeredConfig;
import com.deda.plugin.DiscoveryReport;
import com.deda.plugin.PluginDiscovery;
import com.deda.plugin.PluginProvider;
import com.deda.plugin.PluginRegistry;
import com.deda.plugins.localfiles.LocalFilesPluginProvider;
import com.deda.plugins.localtasks.LocalTasksPluginProvider;
import com.deda.plugins.lognotify.LogNotifyPluginProvider;
import com.deda.plugins.shell.ShellPluginProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Plugin-side bootstrap: creates a {@link PluginDiscovery} with the built-in providers registered.
 * The host calls {@link #discoverAll(PluginDiscovery, PluginRegistry, LayeredConfig)} to register
 * built-ins and the external jars found on the configured plugin search paths.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    private InternalPlugins() {
    }

    /** Built-in providers in registration order (Shell, LocalFiles, LocalTasks, LogNotify). */
    public static List<PluginProvider> builtInProviders() {
        return List.of(
                new ShellPluginProvider(),
                new LocalFilesPluginProvider(),
                new LocalTasksPluginProvider(),
                new LogNotifyPluginProvider());
    }

    /**
     * Creates a discovery with every built-in provider registered and no search paths scanned yet.
     */
    public static PluginDiscovery createDiscovery() {
        return new PluginDiscovery(builtInProviders());
    }

    /**
     * Registers built-ins, then external plugins from {@link LayeredConfig#pluginDirs()}
     * ({@code DEDAVERSE_PLUGIN_DIRS} plus the {@value LayeredConfig#PLUGIN_DIRS_KEY} setting).
     */
    public static DiscoveryReport discoverAll(PluginDiscovery discovery, PluginRegistry registry, LayeredConfig config) {
        DiscoveryReport report = discovery.discover(registry, config.pluginDirs());
        log.info("Plugins: {} built-in, {} registered in total (dirs={})",
                discovery.getBuiltInProviders().size(), registry.size(), config.pluginDirs());
        report.getFailures().forEach((source, reason) -> log.warn("Plugin source {} skipped: {}", source, reason));
        return report;
    }
}
