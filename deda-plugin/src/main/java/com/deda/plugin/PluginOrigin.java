package com.deda.plugin;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where a plugin came from: shipped with the host (built-in) or a jar found on a search path.
 */
public final class PluginOrigin {

    private static final PluginOrigin BUILT_IN = new PluginOrigin(null);

    private final Path path;

    private PluginOrigin(Path path) {
        this.path = path;
    }

    public static PluginOrigin builtIn() {
        return BUILT_IN;
    }

    public static PluginOrigin external(Path jar) {
        return new PluginOrigin(Objects.requireNonNull(jar, "jar").toAbsolutePath().normalize());
    }

    public boolean isBuiltIn() {
        return path == null;
    }

    /** Jar the plugin was loaded from; empty for built-ins. */
    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(path, ((PluginOrigin) o).path);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(path);
    }

    @Override
    public String toString() {
        return isBuiltIn() ? "built-in" : path.toString();
    }
}
