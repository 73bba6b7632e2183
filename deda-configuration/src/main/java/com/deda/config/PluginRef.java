package com.deda.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to a plugin from a configuration layer: the plugin name, an optional version
 * constraint and whether the layer enables it. A project reference to a name overrides user and
 * site references to the same name.
 * <p>
 * Version constraint: {@code null}, blank or {@code *} accepts any version; a trailing
 * {@code .*} (e.g. {@code 1.2.*}) accepts versions with that prefix; anything else must match exactly.
 */
public final class PluginRef {

    private static final String ANY_VERSION = "*";
    private static final String WILDCARD_SUFFIX = ".*";

    private final String name;
    private final String version;
    private final boolean enabled;

    @JsonCreator
    public PluginRef(@JsonProperty("name") String name,
                     @JsonProperty("version") String version,
                     @JsonProperty("enabled") Boolean enabled) {
        this.name = Objects.requireNonNull(name, "name").trim();
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("Plugin reference name must be non-blank");
        }
        this.version = version != null && !version.isBlank() ? version.trim() : null;
        this.enabled = enabled == null || enabled;
    }

    /** Enabled reference accepting any version. */
    public static PluginRef of(String name) {
        return new PluginRef(name, null, true);
    }

    /** Enabled reference pinned to the given version constraint. */
    public static PluginRef pinned(String name, String version) {
        return new PluginRef(name, version, true);
    }

    /** Reference that switches the named plugin off in this layer. */
    public static PluginRef disabled(String name) {
        return new PluginRef(name, null, false);
    }

    public String getName() {
        return name;
    }

    /** Version constraint, or null for any version. */
    public String getVersion() {
        return version;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Whether {@code candidateVersion} satisfies this reference's version constraint. */
    public boolean accepts(String candidateVersion) {
        if (version == null || ANY_VERSION.equals(version)) return true;
        if (candidateVersion == null) return false;
        if (version.endsWith(WILDCARD_SUFFIX)) {
            String prefix = version.substring(0, version.length() - 1);
            return candidateVersion.startsWith(prefix);
        }
        return version.equals(candidateVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginRef that = (PluginRef) o;
        return enabled == that.enabled && name.equals(that.name) && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, enabled);
    }

    @Override
    public String toString() {
        return name + (version != null ? "@" + version : "") + (enabled ? "" : " (disabled)");
    }
}
