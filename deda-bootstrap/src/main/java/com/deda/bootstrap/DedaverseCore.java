package com.deda.bootstrap;

import com.deda.config.EffectiveConfig;
import com.deda.config.LayeredConfig;
import com.deda.lifecycle.AssetId;
import com.deda.lifecycle.AssetRecord;
import com.deda.lifecycle.GateState;
import com.deda.lifecycle.LifecycleManager;
import com.deda.plugin.Capability;
import com.deda.plugin.DiscoveryReport;
import com.deda.plugin.PluginDescriptor;
import com.deda.plugin.PluginDiscovery;
import com.deda.plugin.PluginRegistry;
import com.deda.plugin.PluginSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * What the host application sees of the core: effective configuration, asset transitions and the
 * plugins available per capability. Built by {@link DedaBootstrap}; unusable after {@link #shutdown()}.
 */
public final class DedaverseCore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DedaverseCore.class);

    private final LayeredConfig config;
    private final PluginRegistry registry;
    private final PluginDiscovery discovery;
    private final PluginSelector selector;
    private final LifecycleManager lifecycle;
    private final DiscoveryReport discoveryReport;
    private volatile boolean shutDown;

    DedaverseCore(LayeredConfig config, PluginRegistry registry, PluginDiscovery discovery,
                  PluginSelector selector, LifecycleManager lifecycle, DiscoveryReport discoveryReport) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.discoveryReport = discoveryReport;
    }

    public EffectiveConfig getEffectiveConfig() {
        ensureRunning();
        return config.effective();
    }

    public AssetRecord transitionAsset(AssetId assetId, GateState target) {
        ensureRunning();
        return lifecycle.transition(assetId, target);
    }

    /**
     * String form for hosts: {@code assetId} as {@code prefix::suffix}, {@code targetState} as a state
     * name in any case, with spaces or hyphens for underscores ({@code "in development"}).
     *
     * @throws IllegalArgumentException when either argument does not parse
     */
    public AssetRecord transitionAsset(String assetId, String targetState) {
        return transitionAsset(AssetId.parse(assetId), parseState(targetState));
    }

    /** Loaded and activated plugins for {@code capability}; the first one is the active plugin. */
    public List<PluginDescriptor> listAvailablePlugins(Capability capability) {
        ensureRunning();
        return selector.available(capability);
    }

    public LayeredConfig getConfig() {
        return config;
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    public LifecycleManager getLifecycle() {
        ensureRunning();
        return lifecycle;
    }

    public DiscoveryReport getDiscoveryReport() {
        return discoveryReport;
    }

    public boolean isShutDown() {
        return shutDown;
    }

    /** Unloads every plugin (running their cleanup hooks), closes plugin class loaders and clears the default config. */
    public synchronized void shutdown() {
        if (shutDown) return;
        shutDown = true;
        registry.shutdown();
        discovery.close();
        LayeredConfig.setDefault(null);
        log.info("Dedaverse core shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    static GateState parseState(String name) {
        Objects.requireNonNull(name, "targetState");
        String normalized = name.trim().replace(' ', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return GateState.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown gate state '" + name + "'", e);
        }
    }

    private void ensureRunning() {
        if (shutDown) {
            throw new IllegalStateException("Dedaverse core is shut down");
        }
    }
}
