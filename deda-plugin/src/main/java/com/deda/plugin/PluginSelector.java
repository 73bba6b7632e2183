package com.deda.plugin;

import com.deda.config.LayeredConfig;
import com.deda.config.PluginRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the active plugin for a capability: the first LOADED descriptor, in registration order,
 * that the effective plugin references activate.
 * <p>
 * A reference activates a plugin when it is enabled and its version constraint accepts the
 * plugin's version. When no layer enables any plugin, every loaded plugin not explicitly disabled
 * is active.
 */
public final class PluginSelector {

    private final PluginRegistry registry;
    private final LayeredConfig config;

    public PluginSelector(PluginRegistry registry, LayeredConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Active plugin for {@code capability}, or empty. */
    public Optional<PluginDescriptor> active(Capability capability) {
        List<PluginDescriptor> candidates = available(capability);
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /** Active plugin instance for {@code capability}, cast to its contract. */
    public <T extends Plugin> Optional<T> activePlugin(Capability capability, Class<T> contract) {
        return active(capability).flatMap(d -> d.getPlugin(contract));
    }

    /** Loaded and activated descriptors for {@code capability}, in registration order. */
    public List<PluginDescriptor> available(Capability capability) {
        List<PluginRef> refs = config.activePluginRefs();
        List<PluginDescriptor> out = new ArrayList<>();
        for (PluginDescriptor d : registry.getByCapability(capability)) {
            if (d.isLoaded() && isActivated(d, refs)) {
                out.add(d);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Whether the references activate {@code descriptor}. With no enabled reference at all, anything
     * not explicitly disabled is activated.
     */
    public static boolean isActivated(PluginDescriptor descriptor, List<PluginRef> refs) {
        boolean anyEnabled = false;
        for (PluginRef ref : refs) {
            if (ref.isEnabled()) anyEnabled = true;
            if (ref.getName().equals(descriptor.getName())) {
                return ref.isEnabled() && ref.accepts(descriptor.getVersion());
            }
        }
        return !anyEnabled;
    }
}
