package com.deda.config;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Project configuration stored under {@code <rootDir>/.dedaverse/project.cfg}. Identified by its
 * root directory. Holds project overrides, the plugins activated for the project and lifecycle
 * gating-rule overrides keyed by transition ({@code CANDIDATE->IN_DEVELOPMENT}) or target state
 * ({@code REVIEW}).
 */
public final class ProjectConfig extends LayerConfig {

    private final String name;
    private final String rootDir;
    private final String code;
    private final String projectType;
    private final List<String> assetTypes;
    private final Map<String, List<String>> gatingRules;

    @JsonCreator
    ProjectConfig(@JacksonInject ScopeKey scopeKey,
                  @JsonProperty("name") String name,
                  @JsonProperty("code") String code,
                  @JsonProperty("projectType") String projectType,
                  @JsonProperty("assetTypes") List<String> assetTypes,
                  @JsonProperty("gatingRules") Map<String, List<String>> gatingRules,
                  @JsonProperty("settings") Map<String, Object> settings,
                  @JsonProperty("plugins") List<PluginRef> plugins,
                  @JsonProperty("apps") List<AppConfig> apps,
                  @JsonProperty("savedAtMillis") Long savedAtMillis) {
        super(scopeKey, settings, plugins, apps, savedAtMillis);
        this.rootDir = scopeKey.getLocation();
        this.name = name != null && !name.isBlank() ? name.trim() : defaultName(rootDir);
        this.code = code;
        this.projectType = projectType;
        this.assetTypes = assetTypes != null ? List.copyOf(assetTypes) : List.of();
        this.gatingRules = new LinkedHashMap<>();
        if (gatingRules != null) {
            gatingRules.forEach((k, v) -> this.gatingRules.put(k, v != null ? List.copyOf(v) : List.of()));
        }
    }

    /**
     * New project with defaults, rooted at {@code rootDir}. Nothing is written until the project
     * layer is saved.
     */
    public static ProjectConfig create(String name, Path rootDir) {
        return create(name, rootDir, null, null, null);
    }

    public static ProjectConfig create(String name, Path rootDir, String code, String projectType, List<String> assetTypes) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rootDir, "rootDir");
        return new ProjectConfig(ScopeKey.of(ConfigScope.PROJECT, rootDir), name, code, projectType, assetTypes,
                null, null, null, null, null);
    }

    /** Last path segment of the root; the root itself when it has none (a filesystem root). */
    private static String defaultName(String rootDir) {
        Path fileName = Path.of(rootDir).getFileName();
        return fileName != null ? fileName.toString() : rootDir;
    }

    public String getName() {
        return name;
    }

    /** Absolute project root; not serialized because the file location defines it. */
    @JsonIgnore
    public String getRootDir() {
        return rootDir;
    }

    @JsonIgnore
    public Path getRootPath() {
        return Path.of(rootDir);
    }

    /**
     * Whether this project's config file can be written: true when it does not exist yet,
     * otherwise whether the file is writable by this process.
     */
    @JsonIgnore
    public boolean isWritable() {
        Path file = ConfigLocations.projectConfigFile(getRootPath());
        return !Files.exists(file) || Files.isWritable(file);
    }

    /** Short project code (e.g. {@code FEN}), or null. */
    public String getCode() {
        return code;
    }

    public String getProjectType() {
        return projectType;
    }

    public List<String> getAssetTypes() {
        return assetTypes;
    }

    /** Gating-rule overrides: transition or target-state key → rules that must all hold. */
    public Map<String, List<String>> getGatingRules() {
        return Collections.unmodifiableMap(gatingRules);
    }

    void putGatingRule(String transitionKey, List<String> rules) {
        Objects.requireNonNull(transitionKey, "transitionKey");
        if (rules == null) {
            gatingRules.remove(transitionKey);
        } else {
            gatingRules.put(transitionKey, List.copyOf(rules));
        }
    }
}
