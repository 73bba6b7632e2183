package com.deda.plugin;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one discovery pass: descriptors registered, providers skipped because they are
 * disabled, and per-jar (or per-provider) failures that did not stop discovery.
 */
public final class DiscoveryReport {

    private final List<PluginDescriptor> registered = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    void registered(PluginDescriptor descriptor) {
        registered.add(descriptor);
    }

    void skipped(String providerName) {
        skipped.add(providerName);
    }

    void failed(Path source, String reason) {
        failures.put(source.toString(), reason);
    }

    void failed(String source, String reason) {
        failures.put(source, reason);
    }

    public List<PluginDescriptor> getRegistered() {
        return Collections.unmodifiableList(registered);
    }

    /** Names of providers that reported {@code isEnabled() == false}. */
    public List<String> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    /** Source (jar path, directory or provider name) → failure reason, in discovery order. */
    public Map<String, String> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "DiscoveryReport[registered=" + registered.size() + ", skipped=" + skipped.size()
                + ", failures=" + failures.size() + "]";
    }
}
