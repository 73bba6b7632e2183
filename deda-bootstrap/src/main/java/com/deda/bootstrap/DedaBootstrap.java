package com.deda.bootstrap;

import com.deda.config.ConfigParseException;
import com.deda.config.LayeredConfig;
import com.deda.config.ScopeKey;
import com.deda.internal.plugins.InternalPlugins;
import com.deda.lifecycle.LifecycleManager;
import com.deda.plugin.DiscoveryReport;
import com.deda.plugin.PluginDescriptor;
import com.deda.plugin.PluginDiscovery;
import com.deda.plugin.PluginRegistry;
import com.deda.plugin.PluginSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Process start-up: installs the layered configuration as the process default, discovers and
 * loads plugins, restores the asset lifecycle of the current project and returns the
 * {@link DedaverseCore} the host talks to.
 */
public final class DedaBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DedaBootstrap.class);

    private DedaBootstrap() {
    }

    /** Starts from the environment ({@code DEDAVERSE_SITE_CONFIG}, {@code DEDAVERSE_PLUGIN_DIRS}, ~/.dedaverse). */
    public static DedaverseCore initialize() {
        return initialize(LayeredConfig.getDefault());
    }

    public static DedaverseCore initialize(LayeredConfig config) {
        return initialize(config, Clock.systemUTC(), System.getProperty("user.name", "unknown"));
    }

    /**
     * A malformed site, user or project file does not stop start-up: that layer runs on defaults
     * and its error is available from {@link LayeredConfig#getLoadErrors()}. Plugins that fail to
     * load are logged and left FAILED in the registry; start-up continues.
     *
     * @param actor recorded in the history of transitions made through the returned core
     * @throws com.deda.lifecycle.LifecycleException when the current project holds malformed lifecycle records
     */
    public static DedaverseCore initialize(LayeredConfig config, Clock clock, String actor) {
        LayeredConfig.setDefault(config);
        Map<ScopeKey, ConfigParseException> loadErrors = config.loadLayers();
        if (!loadErrors.isEmpty()) {
            log.error("Bootstrap: {} configuration layer(s) are malformed and run on defaults: {}",
                    loadErrors.size(), loadErrors.keySet());
        }
        log.info("Bootstrap: project={}, plugin dirs={}",
                config.currentProject().map(p -> p.getName()).orElse("<none>"), config.pluginDirs());

        PluginDiscovery discovery = InternalPlugins.createDiscovery();
        PluginRegistry registry = new PluginRegistry(config);
        DiscoveryReport report = InternalPlugins.discoverAll(discovery, registry, config);

        int loaded = 0;
        for (PluginDescriptor descriptor : registry.all()) {
            if (registry.load(descriptor)) {
                loaded++;
            } else {
                log.error("Plugin {} failed to load: {}", descriptor.getId(),
                        descriptor.getFailureReason().orElse("unknown reason"));
            }
        }
        log.info("Bootstrap: {} of {} plugins loaded", loaded, registry.size());
        if (loaded == 0) {
            log.warn("No plugins loaded; check the project selection and DEDAVERSE_PLUGIN_DIRS");
        }

        PluginSelector selector = new PluginSelector(registry, config);
        LifecycleManager lifecycle;
        try {
            lifecycle = new LifecycleManager(config, selector, clock, actor);
        } catch (RuntimeException e) {
            registry.shutdown();
            discovery.close();
            throw e;
        }
        return new DedaverseCore(config, registry, discovery, selector, lifecycle, report);
    }
}
