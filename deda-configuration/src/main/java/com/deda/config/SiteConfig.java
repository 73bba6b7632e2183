package com.deda.config;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Studio-wide configuration shared by every user and project: studio name, plugin update URLs,
 * globally available plugins and the studio's service endpoints.
 */
public final class SiteConfig extends LayerConfig {

    private final String name;
    private final List<String> pluginUrls;
    private final List<ServiceConfig> services;

    @JsonCreator
    SiteConfig(@JacksonInject ScopeKey scopeKey,
               @JsonProperty("name") String name,
               @JsonProperty("pluginUrls") List<String> pluginUrls,
               @JsonProperty("services") List<ServiceConfig> services,
               @JsonProperty("settings") Map<String, Object> settings,
               @JsonProperty("plugins") List<PluginRef> plugins,
               @JsonProperty("apps") List<AppConfig> apps,
               @JsonProperty("savedAtMillis") Long savedAtMillis) {
        super(scopeKey, settings, plugins, apps, savedAtMillis);
        this.name = name;
        this.pluginUrls = pluginUrls != null ? List.copyOf(pluginUrls) : List.of();
        this.services = services != null ? List.copyOf(services) : List.of();
    }

    /** Empty site layer for the given key, used when no site file exists yet. */
    public static SiteConfig defaults(ScopeKey scopeKey) {
        return new SiteConfig(scopeKey, null, null, null, null, null, null, null);
    }

    /** Studio name, or null when not set. */
    public String getName() {
        return name;
    }

    /** Plugin discovery and update URLs in priority order. */
    public List<String> getPluginUrls() {
        return pluginUrls;
    }

    public List<ServiceConfig> getServices() {
        return Collections.unmodifiableList(services);
    }
}
