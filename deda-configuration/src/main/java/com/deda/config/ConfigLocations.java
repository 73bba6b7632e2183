package com.deda.config;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Where each configuration layer lives, derived from the environment.
 * <p>
 * Site: {@code DEDAVERSE_SITE_CONFIG} (file path; unset = no site file).
 * User: {@code DEDAVERSE_USER_DIR}, default {@code ~/.dedaverse}, file {@code user.cfg}.
 * Project: {@code <projectRoot>/.dedaverse/project.cfg}.
 * Extra plugin search paths: {@code DEDAVERSE_PLUGIN_DIRS}, separated by the platform path separator.
 */
public final class ConfigLocations {

    public static final String ENV_SITE_CONFIG = "DEDAVERSE_SITE_CONFIG";
    public static final String ENV_USER_DIR = "DEDAVERSE_USER_DIR";
    public static final String ENV_PLUGIN_DIRS = "DEDAVERSE_PLUGIN_DIRS";

    /** Directory name used for user and project configuration. */
    public static final String CONFIG_DIR_NAME = ".dedaverse";
    public static final String USER_CONFIG_FILE = "user.cfg";
    public static final String PROJECT_CONFIG_FILE = "project.cfg";

    private final Path siteConfigFile;
    private final Path userDir;
    private final List<Path> pluginDirs;

    private ConfigLocations(Builder b) {
        this.siteConfigFile = b.siteConfigFile;
        this.userDir = b.userDir != null ? b.userDir : defaultUserDir();
        this.pluginDirs = Collections.unmodifiableList(new ArrayList<>(b.pluginDirs));
    }

    public static ConfigLocations fromEnvironment() {
        String site = getEnv(ENV_SITE_CONFIG);
        String userDir = getEnv(ENV_USER_DIR);
        return builder()
                .siteConfigFile(site != null ? Paths.get(site) : null)
                .userDir(userDir != null ? Paths.get(userDir) : null)
                .pluginDirs(parsePathList(System.getenv(ENV_PLUGIN_DIRS)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Site config file, or null when {@code DEDAVERSE_SITE_CONFIG} is unset. */
    public Path getSiteConfigFile() {
        return siteConfigFile;
    }

    public Path getUserDir() {
        return userDir;
    }

    public Path getUserConfigFile() {
        return userDir.resolve(USER_CONFIG_FILE);
    }

    /** Plugin search paths from the environment (configured paths from layers are added by the resolver). */
    public List<Path> getPluginDirs() {
        return pluginDirs;
    }

    /** Project config file for the given project root. */
    public static Path projectConfigFile(Path projectRoot) {
        return projectRoot.resolve(CONFIG_DIR_NAME).resolve(PROJECT_CONFIG_FILE);
    }

    /** Splits a path-separator-delimited list, ignoring blanks. */
    public static List<Path> parsePathList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(Pattern.quote(File.pathSeparator)))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Paths::get)
                .collect(Collectors.toList());
    }

    private static Path defaultUserDir() {
        return Paths.get(System.getProperty("user.home")).resolve(CONFIG_DIR_NAME);
    }

    private static String getEnv(String key) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : null;
    }

    public static final class Builder {
        private Path siteConfigFile;
        private Path userDir;
        private List<Path> pluginDirs = List.of();

        public Builder siteConfigFile(Path siteConfigFile) {
            this.siteConfigFile = siteConfigFile;
            return this;
        }

        public Builder userDir(Path userDir) {
            this.userDir = userDir;
            return this;
        }

        public Builder pluginDirs(List<Path> pluginDirs) {
            this.pluginDirs = Objects.requireNonNull(pluginDirs, "pluginDirs");
            return this;
        }

        public ConfigLocations build() {
            return new ConfigLocations(this);
        }
    }
}
