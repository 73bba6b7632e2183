package com.deda.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identity of a configuration record: its scope plus the location that scopes it
 * (site file, user directory or project root). Config records compare and hash by this key only,
 * so sets and maps of loaded records stay stable while their settings are edited.
 */
public final class ScopeKey {

    private final ConfigScope scope;
    private final String location;

    private ScopeKey(ConfigScope scope, String location) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.location = location != null ? location : "";
    }

    /**
     * Key for a layer backed by the given location. The path is made absolute and normalized so
     * {@code ./proj} and {@code /work/proj} identify the same project.
     */
    public static ScopeKey of(ConfigScope scope, Path location) {
        Objects.requireNonNull(location, "location");
        return new ScopeKey(scope, location.toAbsolutePath().normalize().toString());
    }

    /** Key for a layer with no backing location (e.g. a site layer when no site file is configured). */
    public static ScopeKey unbound(ConfigScope scope) {
        return new ScopeKey(scope, "");
    }

    public ConfigScope getScope() {
        return scope;
    }

    /** Absolute location string, or empty when {@link #isBound()} is false. */
    public String getLocation() {
        return location;
    }

    public boolean isBound() {
        return !location.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScopeKey that = (ScopeKey) o;
        return scope == that.scope && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, location);
    }

    @Override
    public String toString() {
        return isBound() ? scope + ":" + location : scope + ":<unbound>";
    }
}
