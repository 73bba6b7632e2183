package com.deda.plugin;

import java.util.Objects;

/**
 * Registry key of a plugin: name plus version. Two providers with the same name and version are
 * the same plugin; the later registration replaces the earlier one.
 */
public final class PluginId {

    private final String name;
    private final String version;

    private PluginId(String name, String version) {
        this.name = name;
        this.version = version;
    }

    /**
     * @throws IllegalArgumentException if name or version is blank
     */
    public static PluginId of(String name, String version) {
        String n = Objects.requireNonNull(name, "name").trim();
        String v = Objects.requireNonNull(version, "version").trim();
        if (n.isEmpty() || v.isEmpty()) {
            throw new IllegalArgumentException("Plugin name and version must be non-blank: '" + name + "'@'" + version + "'");
        }
        return new PluginId(n, v);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginId that = (PluginId) o;
        return name.equals(that.name) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version);
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
