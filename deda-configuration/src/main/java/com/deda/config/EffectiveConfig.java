package com.deda.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable merged view of the site, user and project layers. Settings, plugin references and apps
 * from a higher-precedence layer replace those from lower layers key by key; service endpoints come
 * from the site layer only; keys absent from every
 * layer resolve to {@link ResolvedSetting#notConfigured(String)}.
 */
public final class EffectiveConfig {

    private final Map<String, ResolvedSetting> settings;
    private final List<PluginRef> pluginRefs;
    private final List<AppConfig> apps;
    private final List<ServiceConfig> services;
    private final Map<String, List<String>> gatingRules;
    private final String projectName;

    private EffectiveConfig(Map<String, ResolvedSetting> settings, List<PluginRef> pluginRefs, List<AppConfig> apps,
                            List<ServiceConfig> services, Map<String, List<String>> gatingRules, String projectName) {
        this.settings = Collections.unmodifiableMap(settings);
        this.pluginRefs = Collections.unmodifiableList(pluginRefs);
        this.apps = Collections.unmodifiableList(apps);
        this.services = List.copyOf(services);
        this.gatingRules = Collections.unmodifiableMap(gatingRules);
        this.projectName = projectName;
    }

    /**
     * Merges the layers in precedence order. Any layer may be null (e.g. no current project).
     */
    public static EffectiveConfig merge(SiteConfig site, UserConfig user, ProjectConfig project) {
        Map<String, ResolvedSetting> merged = new LinkedHashMap<>();
        Map<String, PluginRef> refs = new LinkedHashMap<>();
        Map<AppConfig, AppConfig> apps = new LinkedHashMap<>();
        for (LayerConfig layer : new LayerConfig[]{site, user, project}) {
            if (layer == null) continue;
            ConfigScope scope = layer.getScope();
            layer.getSettings().forEach((k, v) -> merged.put(k, ResolvedSetting.of(k, v, scope)));
            for (PluginRef ref : layer.getPlugins()) {
                refs.put(ref.getName(), ref);
            }
            for (AppConfig app : layer.getApps()) {
                apps.remove(app);
                apps.put(app, app);
            }
        }
        Map<String, List<String>> rules = project != null ? new LinkedHashMap<>(project.getGatingRules()) : Map.of();
        List<ServiceConfig> services = site != null ? site.getServices() : List.of();
        return new EffectiveConfig(merged, new ArrayList<>(refs.values()), new ArrayList<>(apps.values()), services,
                rules, project != null ? project.getName() : null);
    }

    /** Empty view (no layers). */
    public static EffectiveConfig empty() {
        return merge(null, null, null);
    }

    public ResolvedSetting get(String key) {
        ResolvedSetting s = settings.get(key);
        return s != null ? s : ResolvedSetting.notConfigured(key);
    }

    public boolean isConfigured(String key) {
        return settings.containsKey(key);
    }

    public String getString(String key, String defaultValue) {
        return get(key).asString(defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return get(key).asBoolean(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return get(key).asInt(defaultValue);
    }

    public List<String> getStringList(String key) {
        return get(key).asStringList();
    }

    /** Resolved settings by key, in first-seen order. */
    public Map<String, ResolvedSetting> getSettings() {
        return settings;
    }

    /** Plain key → value view of the merged settings. */
    public Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        settings.forEach((k, v) -> out.put(k, v.getValue()));
        return Collections.unmodifiableMap(out);
    }

    /** Merged plugin references; one per plugin name, from the highest layer that names it. */
    public List<PluginRef> getPluginRefs() {
        return pluginRefs;
    }

    public Optional<PluginRef> findPluginRef(String name) {
        return pluginRefs.stream().filter(r -> r.getName().equals(name)).findFirst();
    }

    /**
     * Merged apps; one per name and version, from the highest layer that declares it. An app
     * overridden by a higher layer moves to that layer's position.
     */
    public List<AppConfig> getApps() {
        return apps;
    }

    public Optional<AppConfig> findApp(String name, String version) {
        String v = version != null ? version.trim() : "";
        return apps.stream().filter(a -> a.getName().equals(name) && a.getVersion().equals(v)).findFirst();
    }

    /** Service endpoints declared by the site. */
    public List<ServiceConfig> getServices() {
        return services;
    }

    public Optional<ServiceConfig> findService(String name) {
        return services.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    /** Gating-rule overrides from the current project (empty when no project is current). */
    public Map<String, List<String>> getGatingRules() {
        return gatingRules;
    }

    /** Name of the project merged into this view, or null. */
    public String getProjectName() {
        return projectName;
    }
}
