package com.deda.config;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-operator configuration: known projects (name to root directory), the project currently
 * worked on, the operator's production roles, plus settings and plugin references.
 */
public final class UserConfig extends LayerConfig {

    private final Map<String, String> projects;
    private final List<String> roles;
    private volatile String currentProject;

    @JsonCreator
    UserConfig(@JacksonInject ScopeKey scopeKey,
               @JsonProperty("currentProject") String currentProject,
               @JsonProperty("projects") Map<String, String> projects,
               @JsonProperty("roles") List<String> roles,
               @JsonProperty("settings") Map<String, Object> settings,
               @JsonProperty("plugins") List<PluginRef> plugins,
               @JsonProperty("apps") List<AppConfig> apps,
               @JsonProperty("savedAtMillis") Long savedAtMillis) {
        super(scopeKey, settings, plugins, apps, savedAtMillis);
        this.currentProject = currentProject != null && !currentProject.isBlank() ? currentProject.trim() : null;
        this.projects = projects != null ? new LinkedHashMap<>(projects) : new LinkedHashMap<>();
        this.roles = roles != null ? new ArrayList<>(roles) : new ArrayList<>();
    }

    /** Empty user layer for the given key, used when no user file exists yet. */
    public static UserConfig defaults(ScopeKey scopeKey) {
        return new UserConfig(scopeKey, null, null, null, null, null, null, null);
    }

    /** Name of the current project, or null when none is selected. */
    public String getCurrentProject() {
        return currentProject;
    }

    /** Known projects: project name → project root directory. */
    public Map<String, String> getProjects() {
        return Collections.unmodifiableMap(projects);
    }

    /** Production roles of this operator (e.g. animator, rigger). */
    public List<String> getRoles() {
        return Collections.unmodifiableList(roles);
    }

    void putProject(String name, String rootDir) {
        projects.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(rootDir, "rootDir"));
    }

    /**
     * Re-keys a known project, keeping its position in the list. The current project follows the
     * rename.
     */
    void renameProject(String oldName, String newName) {
        Objects.requireNonNull(newName, "newName");
        String root = projects.get(oldName);
        if (root == null || oldName.equals(newName)) return;
        Map<String, String> renamed = new LinkedHashMap<>();
        projects.forEach((k, v) -> {
            if (k.equals(oldName)) {
                renamed.put(newName, v);
            } else if (!k.equals(newName)) {
                renamed.put(k, v);
            }
        });
        projects.clear();
        projects.putAll(renamed);
        if (oldName.equals(currentProject)) {
            currentProject = newName;
        }
    }

    void setCurrentProject(String name) {
        this.currentProject = name;
    }

    void setRoles(List<String> newRoles) {
        roles.clear();
        if (newRoles != null) roles.addAll(newRoles);
    }
}
