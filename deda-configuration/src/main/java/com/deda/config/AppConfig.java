package com.deda.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A desktop application offered to artists (DCC tool, viewer, editor) with how to launch, install
 * and get help for it. Any layer may declare apps; an app is identified by name and version, so two
 * versions of the same tool can be listed side by side.
 */
public final class AppConfig {

    private final String name;
    private final String version;
    private final String command;
    private final String iconPath;
    private final String installUrl;
    private final String helpUrl;
    private final boolean enabled;

    @JsonCreator
    public AppConfig(@JsonProperty("name") String name,
                     @JsonProperty("version") String version,
                     @JsonProperty("command") String command,
                     @JsonProperty("iconPath") String iconPath,
                     @JsonProperty("installUrl") String installUrl,
                     @JsonProperty("helpUrl") String helpUrl,
                     @JsonProperty("enabled") Boolean enabled) {
        this.name = Objects.requireNonNull(name, "name").trim();
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("App name must be non-blank");
        }
        this.version = version != null ? version.trim() : "";
        this.command = command;
        this.iconPath = iconPath;
        this.installUrl = installUrl;
        this.helpUrl = helpUrl;
        this.enabled = enabled == null || enabled;
    }

    public String getName() {
        return name;
    }

    /** Version label; empty when unversioned. */
    public String getVersion() {
        return version;
    }

    /** Command line used to launch the app, or null when it cannot be launched from here. */
    public String getCommand() {
        return command;
    }

    public String getIconPath() {
        return iconPath;
    }

    public String getInstallUrl() {
        return installUrl;
    }

    public String getHelpUrl() {
        return helpUrl;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppConfig that = (AppConfig) o;
        return name.equals(that.name) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version);
    }

    @Override
    public String toString() {
        return version.isEmpty() ? name : name + " " + version;
    }
}
