package com.deda.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Common shape of the site, user and project configuration records: named settings, plugin
 * references, offered applications and the time of the last save. Records are created with defaults when their backing
 * file does not exist, changed only through {@link LayeredConfig} (which holds the per-scope write
 * lock) and written only on an explicit save.
 * <p>
 * Equality and hash code use {@link #getScopeKey()} only, never the settings.
 */
public abstract class LayerConfig {

    private final ScopeKey scopeKey;
    private final Map<String, Object> settings;
    private final List<PluginRef> plugins;
    private final List<AppConfig> apps;
    private volatile long savedAtMillis;

    protected LayerConfig(ScopeKey scopeKey, Map<String, Object> settings, List<PluginRef> plugins,
                          List<AppConfig> apps, Long savedAtMillis) {
        this.scopeKey = Objects.requireNonNull(scopeKey, "scopeKey");
        this.settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
        this.plugins = plugins != null ? new ArrayList<>(plugins) : new ArrayList<>();
        this.apps = apps != null ? new ArrayList<>(apps) : new ArrayList<>();
        this.savedAtMillis = savedAtMillis != null ? savedAtMillis : 0L;
    }

    @JsonIgnore
    public ScopeKey getScopeKey() {
        return scopeKey;
    }

    @JsonIgnore
    public ConfigScope getScope() {
        return scopeKey.getScope();
    }

    /** Read-only view of this layer's own settings (no fall-through to other layers). */
    @JsonProperty("settings")
    public Map<String, Object> getSettings() {
        return Collections.unmodifiableMap(settings);
    }

    /** Value set in this layer, or empty when the key is absent here. A key explicitly set to null is present. */
    public Optional<Object> find(String key) {
        return Optional.ofNullable(settings.get(Objects.requireNonNull(key, "key")));
    }

    public boolean contains(String key) {
        return settings.containsKey(key);
    }

    /** Plugin references declared by this layer, in declaration order. */
    @JsonProperty("plugins")
    public List<PluginRef> getPlugins() {
        return Collections.unmodifiableList(plugins);
    }

    @JsonProperty("apps")
    public List<AppConfig> getApps() {
        return Collections.unmodifiableList(apps);
    }

    /** Epoch millis of the last successful save; 0 if never saved. */
    @JsonProperty("savedAtMillis")
    public long getSavedAtMillis() {
        return savedAtMillis;
    }

    void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Setting key must be non-blank");
        }
        settings.put(key, value);
    }

    boolean remove(String key) {
        if (!settings.containsKey(key)) return false;
        settings.remove(key);
        return true;
    }

    /** Adds the reference, replacing any earlier reference with the same plugin name in place. */
    void putPlugin(PluginRef ref) {
        Objects.requireNonNull(ref, "ref");
        for (int i = 0; i < plugins.size(); i++) {
            if (plugins.get(i).getName().equals(ref.getName())) {
                plugins.set(i, ref);
                return;
            }
        }
        plugins.add(ref);
    }

    boolean removePlugin(String name) {
        return plugins.removeIf(p -> p.getName().equals(name));
    }

    /** Adds the app, replacing an entry with the same name and version in place. */
    void putApp(AppConfig app) {
        Objects.requireNonNull(app, "app");
        int i = apps.indexOf(app);
        if (i >= 0) {
            apps.set(i, app);
        } else {
            apps.add(app);
        }
    }

    boolean removeApp(String name, String version) {
        String v = version != null ? version.trim() : "";
        return apps.removeIf(a -> a.getName().equals(name) && a.getVersion().equals(v));
    }

    void markSaved(long millis) {
        this.savedAtMillis = millis;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return scopeKey.equals(((LayerConfig) o).scopeKey);
    }

    @Override
    public final int hashCode() {
        return scopeKey.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + scopeKey + "]";
    }
}
