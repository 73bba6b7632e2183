package com.deda.plugin;

import com.deda.annotations.ResourceCleanup;
import com.deda.config.LayeredConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of plugins keyed by {@link PluginId}. Registration order is kept and is the order of
 * every listing, so capability lookups are stable across runs.
 * <p>
 * Registration only describes a plugin; nothing is instantiated until {@link #load(PluginDescriptor)}.
 * Lookups never auto-load. Load failures are recorded on the descriptor and logged, never thrown.
 */
public final class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    /** PluginId → descriptor, in registration order. */
    private final Map<PluginId, PluginDescriptor> plugins = new LinkedHashMap<>();
    private final LayeredConfig config;

    /** Registry whose plugins load with no configuration and no project. */
    public PluginRegistry() {
        this(null);
    }

    /**
     * @param config configuration handed to plugins when they load; null for none
     */
    public PluginRegistry(LayeredConfig config) {
        this.config = config;
    }

    /**
     * Registers the plugin described by {@code provider}. Registering an id that is already present
     * replaces the earlier entry in place (keeping its position); a loaded earlier entry is unloaded first.
     *
     * @return the new descriptor, in state UNLOADED
     * @throws IllegalArgumentException if the provider's name or version is blank or it declares no capabilities
     */
    public PluginDescriptor register(PluginProvider provider, PluginOrigin origin) {
        return register(new PluginDescriptor(provider, origin));
    }

    /**
     * Registers a descriptor, replacing any entry with the same id in place.
     */
    public PluginDescriptor register(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        PluginDescriptor previous;
        synchronized (plugins) {
            previous = plugins.put(descriptor.getId(), descriptor);
        }
        if (previous != null && previous != descriptor) {
            log.info("Plugin {} registered again from {}; replacing entry from {}",
                    descriptor.getId(), descriptor.getOrigin(), previous.getOrigin());
            unload(previous);
        } else if (previous == null) {
            log.debug("Registered plugin {} {} from {}", descriptor.getId(), descriptor.getCapabilities(),
                    descriptor.getOrigin());
        }
        return descriptor;
    }

    /** Latest registered version of the named plugin. */
    public Optional<PluginDescriptor> get(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String n = name.trim();
        PluginDescriptor found = null;
        for (PluginDescriptor d : all()) {
            if (d.getName().equals(n)) found = d;
        }
        return Optional.ofNullable(found);
    }

    public Optional<PluginDescriptor> get(String name, String version) {
        if (name == null || version == null || name.isBlank() || version.isBlank()) return Optional.empty();
        synchronized (plugins) {
            return Optional.ofNullable(plugins.get(PluginId.of(name, version)));
        }
    }

    /** Descriptors declaring {@code capability}, in registration order; empty list when none. */
    public List<PluginDescriptor> getByCapability(Capability capability) {
        Objects.requireNonNull(capability, "capability");
        List<PluginDescriptor> out = new ArrayList<>();
        for (PluginDescriptor d : all()) {
            if (d.hasCapability(capability)) out.add(d);
        }
        return Collections.unmodifiableList(out);
    }

    /** All descriptors in registration order. */
    public List<PluginDescriptor> all() {
        synchronized (plugins) {
            return List.copyOf(plugins.values());
        }
    }

    public int size() {
        synchronized (plugins) {
            return plugins.size();
        }
    }

    /**
     * Loads a plugin: creates the instance, checks it implements every declared capability contract
     * and runs its {@link Plugin#load(PluginContext)} hook. Any failure, including linkage errors from
     * a broken jar, leaves the descriptor FAILED with the reason recorded.
     *
     * @return true when the plugin is LOADED (also when it already was)
     */
    public boolean load(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        synchronized (descriptor) {
            if (descriptor.getState() == LoadState.LOADED) {
                return true;
            }
            if (descriptor.getState() == LoadState.LOADING) {
                log.warn("Plugin {} is already loading", descriptor.getId());
                return false;
            }
            PluginId id = descriptor.getId();
            descriptor.markLoading();
            Plugin plugin = null;
            try {
                plugin = descriptor.getProvider().createPlugin();
                if (plugin == null) {
                    throw new PluginLoadException(id, "Provider of " + id + " returned no plugin instance", null);
                }
                for (Capability capability : descriptor.getCapabilities()) {
                    if (!capability.isImplementedBy(plugin)) {
                        throw new PluginLoadException(id, "Plugin " + id + " declares " + capability
                                + " but does not implement " + capability.getContract().getSimpleName(), null);
                    }
                }
                plugin.load(contextFor(id));
                descriptor.markLoaded(plugin);
                log.info("Loaded plugin {} from {}", id, descriptor.getOrigin());
                return true;
            } catch (PluginLoadException e) {
                fail(descriptor, plugin, e);
                return false;
            } catch (Exception | LinkageError e) {
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                fail(descriptor, plugin, new PluginLoadException(id, reason, e));
                return false;
            }
        }
    }

    /**
     * Unloads a loaded plugin, calling {@link ResourceCleanup#onExit()} when it implements it.
     *
     * @return true when the plugin was loaded
     */
    public boolean unload(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        synchronized (descriptor) {
            if (descriptor.getState() != LoadState.LOADED) {
                return false;
            }
            cleanup(descriptor.getId(), descriptor.getInstance());
            descriptor.markUnloaded();
            log.info("Unloaded plugin {}", descriptor.getId());
            return true;
        }
    }

    /** Unloads every loaded plugin in reverse registration order. */
    public void shutdown() {
        List<PluginDescriptor> all = new ArrayList<>(all());
        Collections.reverse(all);
        int n = 0;
        for (PluginDescriptor d : all) {
            if (unload(d)) n++;
        }
        log.info("Plugin registry shut down; {} plugin(s) unloaded", n);
    }

    private PluginContext contextFor(PluginId id) {
        return config != null ? PluginContext.of(id, config) : PluginContext.standalone(id);
    }

    private void fail(PluginDescriptor descriptor, Plugin partial, PluginLoadException e) {
        descriptor.markFailed(e);
        log.error("Plugin {} failed to load: {}", descriptor.getId(), e.getMessage(),
                e.getCause() != null ? e.getCause() : e);
        if (partial != null) {
            cleanup(descriptor.getId(), partial);
        }
    }

    private static void cleanup(PluginId id, Plugin plugin) {
        if (!(plugin instanceof ResourceCleanup)) return;
        try {
            ((ResourceCleanup) plugin).onExit();
        } catch (RuntimeException e) {
            log.warn("Plugin {} onExit failed: {}", id, e.getMessage(), e);
        }
    }
}
