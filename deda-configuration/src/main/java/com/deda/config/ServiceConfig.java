package com.deda.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A studio service endpoint declared at site level (e.g. the revision-control server or task tracker).
 * Services are identified by name only; users and projects cannot redefine a site service.
 */
public final class ServiceConfig {

    private final String name;
    private final String url;
    private final boolean enabled;
    private final List<String> params;

    @JsonCreator
    public ServiceConfig(@JsonProperty("name") String name,
                         @JsonProperty("url") String url,
                         @JsonProperty("enabled") Boolean enabled,
                         @JsonProperty("params") List<String> params) {
        this.name = Objects.requireNonNull(name, "name").trim();
        this.url = url;
        this.enabled = enabled == null || enabled;
        this.params = params != null ? List.copyOf(params) : List.of();
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((ServiceConfig) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
