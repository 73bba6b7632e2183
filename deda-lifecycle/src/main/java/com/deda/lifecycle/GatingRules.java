package com.deda.lifecycle;

import com.deda.config.ConfigScope;
import com.deda.config.EffectiveConfig;
import com.deda.config.ResolvedSetting;
import com.deda.plugin.TaskManagerPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Gating rules of a transition and their evaluation.
 * <p>
 * Rules come from the settings {@code lifecycle.gates.<FROM>-><TO>} and {@code lifecycle.gates.<TO>}
 * and from the current project's {@code gatingRules} (same two keys). Sources are ranked by layer
 * first, so anything the project says beats a user or site setting. Within the project layer the
 * order is: exact setting, exact {@code gatingRules} entry, target-state setting, target-state
 * entry. When no layer names the transition the built-in defaults apply. A configured empty list
 * means no requirement.
 * <p>
 * Vocabulary (case-insensitive keywords):
 * <ul>
 *   <li>{@code none}, {@code no requirement}: always holds</li>
 *   <li>{@code linked-task}: at least one task is linked</li>
 *   <li>{@code linked-task-status:<STATE>}: every linked task reports STATE through the active task manager</li>
 *   <li>{@code versioned-file}: a file manager has opened the asset's versioned file</li>
 *   <li>{@code setting:<key>=<value>}: the effective setting equals value</li>
 * </ul>
 * Anything else fails the gate.
 */
public final class GatingRules {

    private static final Logger log = LoggerFactory.getLogger(GatingRules.class);

    public static final String KEY_PREFIX = "lifecycle.gates.";

    public static final String NONE = "none";
    public static final String NO_REQUIREMENT = "no requirement";
    public static final String LINKED_TASK = "linked-task";
    public static final String LINKED_TASK_STATUS = "linked-task-status:";
    public static final String VERSIONED_FILE = "versioned-file";
    public static final String SETTING = "setting:";

    private static final List<ConfigScope> HIGHEST_LAYER_FIRST =
            List.of(ConfigScope.PROJECT, ConfigScope.USER, ConfigScope.SITE);

    private static final Map<GateState, List<String>> DEFAULTS = new EnumMap<>(GateState.class);

    static {
        DEFAULTS.put(GateState.CANDIDATE, List.of(NO_REQUIREMENT));
        DEFAULTS.put(GateState.IN_DEVELOPMENT, List.of(NO_REQUIREMENT));
        DEFAULTS.put(GateState.REVIEW, List.of(LINKED_TASK, VERSIONED_FILE));
        DEFAULTS.put(GateState.PRODUCTION_READY, List.of(LINKED_TASK));
        DEFAULTS.put(GateState.REJECTED, List.of(NO_REQUIREMENT));
    }

    private GatingRules() {
    }

    public static String transitionKey(GateState from, GateState to) {
        return from + "->" + to;
    }

    /** Built-in rules for entering {@code to}. */
    public static List<String> defaults(GateState to) {
        return DEFAULTS.getOrDefault(to, Collections.emptyList());
    }

    /** Rules that apply to {@code from -> to} under {@code config}. */
    public static List<String> rulesFor(EffectiveConfig config, GateState from, GateState to) {
        String exact = transitionKey(from, to);
        ResolvedSetting exactSetting = config.get(KEY_PREFIX + exact);
        ResolvedSetting targetSetting = config.get(KEY_PREFIX + to);
        Map<String, List<String>> projectRules = config.getGatingRules();
        for (ConfigScope scope : HIGHEST_LAYER_FIRST) {
            boolean project = scope == ConfigScope.PROJECT;
            if (definedIn(exactSetting, scope)) {
                return exactSetting.asStringList();
            }
            if (project && projectRules.containsKey(exact)) {
                return projectRules.get(exact);
            }
            if (definedIn(targetSetting, scope)) {
                return targetSetting.asStringList();
            }
            if (project && projectRules.containsKey(to.name())) {
                return projectRules.get(to.name());
            }
        }
        return defaults(to);
    }

    private static boolean definedIn(ResolvedSetting setting, ConfigScope scope) {
        return setting.isConfigured() && setting.getSource() == scope;
    }

    /**
     * Evaluates every rule against the record.
     *
     * @param taskManager active task manager, used by {@code linked-task-status}
     * @return unmet rules, each followed by why; empty when the gate holds
     */
    public static List<String> unmet(List<String> rules, AssetRecord record, EffectiveConfig config,
                                     Optional<TaskManagerPlugin> taskManager) {
        List<String> out = new ArrayList<>();
        for (String rule : rules) {
            String failure = check(rule, record, config, taskManager);
            if (failure != null) {
                out.add(rule + " (" + failure + ")");
            }
        }
        return out;
    }

    /** Null when the rule holds, otherwise why not. */
    private static String check(String rawRule, AssetRecord record, EffectiveConfig config,
                                Optional<TaskManagerPlugin> taskManager) {
        String rule = rawRule == null ? "" : rawRule.trim();
        String keyword = rule.toLowerCase(Locale.ROOT);
        if (keyword.equals(NONE) || keyword.equals(NO_REQUIREMENT)) {
            return null;
        }
        if (keyword.equals(LINKED_TASK)) {
            return record.getLinkedTasks().isEmpty() ? "no task is linked" : null;
        }
        if (keyword.equals(VERSIONED_FILE)) {
            return record.getVersionedFile() == null ? "no versioned file" : null;
        }
        if (keyword.startsWith(LINKED_TASK_STATUS)) {
            String expected = rule.substring(LINKED_TASK_STATUS.length()).trim();
            return checkTaskStatus(expected, record, taskManager);
        }
        if (keyword.startsWith(SETTING)) {
            String assignment = rule.substring(SETTING.length());
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                return "malformed setting rule, expected setting:<key>=<value>";
            }
            String key = assignment.substring(0, eq).trim();
            String expected = assignment.substring(eq + 1).trim();
            String actual = config.getString(key, null);
            if (actual == null) return key + " is not configured";
            return expected.equals(actual) ? null : key + " is '" + actual + "'";
        }
        return "unknown rule";
    }

    private static String checkTaskStatus(String expected, AssetRecord record, Optional<TaskManagerPlugin> taskManager) {
        if (expected.isEmpty()) {
            return "no status given";
        }
        if (record.getLinkedTasks().isEmpty()) {
            return "no task is linked";
        }
        if (taskManager.isEmpty()) {
            return "no active task manager";
        }
        for (String taskId : record.getLinkedTasks()) {
            String status;
            try {
                status = taskManager.get().status(taskId);
            } catch (IOException | RuntimeException e) {
                log.warn("Could not read status of task {} for {}", taskId, record.getId(), e);
                return "status of " + taskId + " unavailable: " + e.getMessage();
            }
            if (status == null || !expected.equalsIgnoreCase(status.trim())) {
                return taskId + " is '" + status + "'";
            }
        }
        return null;
    }
}
