package com.deda.plugin;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry entry for one plugin: identity, declared capabilities, metadata, origin and load state.
 * Created by the registry from a {@link PluginProvider}; state changes only through
 * {@link PluginRegistry#load(PluginDescriptor)} and {@link PluginRegistry#unload(PluginDescriptor)}.
 */
public final class PluginDescriptor {

    private final PluginId id;
    private final Set<Capability> capabilities;
    private final String vendor;
    private final String description;
    private final PluginOrigin origin;
    private final PluginProvider provider;

    private volatile LoadState state = LoadState.UNLOADED;
    private volatile String failureReason;
    private volatile PluginLoadException failure;
    private volatile Plugin instance;

    PluginDescriptor(PluginProvider provider, PluginOrigin origin) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.id = PluginId.of(provider.getName(), provider.getVersion());
        Set<Capability> declared = provider.getCapabilities();
        if (declared == null || declared.isEmpty()) {
            throw new IllegalArgumentException("Plugin " + id + " declares no capabilities");
        }
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(declared));
        this.vendor = provider.getVendor() != null ? provider.getVendor() : "";
        this.description = provider.getDescription() != null ? provider.getDescription() : "";
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public PluginId getId() {
        return id;
    }

    public String getName() {
        return id.getName();
    }

    public String getVersion() {
        return id.getVersion();
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(Capability capability) {
        return capabilities.contains(capability);
    }

    public String getVendor() {
        return vendor;
    }

    public String getDescription() {
        return description;
    }

    public PluginOrigin getOrigin() {
        return origin;
    }

    public LoadState getState() {
        return state;
    }

    public boolean isLoaded() {
        return state == LoadState.LOADED;
    }

    /** Reason of the last failed load, or empty. Cleared by a successful load. */
    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    /** Exception of the last failed load, or empty. */
    public Optional<PluginLoadException> getFailure() {
        return Optional.ofNullable(failure);
    }

    /** The loaded instance; empty unless {@link #isLoaded()}. */
    public Optional<Plugin> getPlugin() {
        return state == LoadState.LOADED ? Optional.ofNullable(instance) : Optional.empty();
    }

    /**
     * The loaded instance as the given contract, or empty when not loaded or not implementing it.
     */
    public <T extends Plugin> Optional<T> getPlugin(Class<T> contract) {
        return getPlugin().filter(contract::isInstance).map(contract::cast);
    }

    PluginProvider getProvider() {
        return provider;
    }

    Plugin getInstance() {
        return instance;
    }

    void markLoading() {
        this.state = LoadState.LOADING;
    }

    void markLoaded(Plugin plugin) {
        this.instance = plugin;
        this.failureReason = null;
        this.failure = null;
        this.state = LoadState.LOADED;
    }

    void markFailed(PluginLoadException cause) {
        this.instance = null;
        this.failure = cause;
        this.failureReason = cause.getMessage();
        this.state = LoadState.FAILED;
    }

    void markUnloaded() {
        this.instance = null;
        this.state = LoadState.UNLOADED;
    }

    @Override
    public String toString() {
        return id + " " + capabilities + " [" + state + ", " + origin + "]";
    }
}
