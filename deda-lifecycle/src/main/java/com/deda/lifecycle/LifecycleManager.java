package com.deda.lifecycle;

import com.deda.config.ConfigCodec;
import com.deda.config.ConfigScope;
import com.deda.config.EffectiveConfig;
import com.deda.config.LayeredConfig;
import com.deda.config.ProjectConfig;
import com.deda.config.ResolvedSetting;
import com.deda.plugin.Capability;
import com.deda.plugin.FileManagerPlugin;
import com.deda.plugin.NotificationPlugin;
import com.deda.plugin.PluginDescriptor;
import com.deda.plugin.PluginSelector;
import com.deda.plugin.TaskManagerPlugin;
import com.deda.plugin.TaskSpec;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Gated asset lifecycle. A transition is checked in three stages, each stopping the transition
 * when it fails:
 * <ol>
 *   <li>adjacency ({@link IllegalTransitionException}, nothing recorded)</li>
 *   <li>gating rules ({@link GatingViolationException}, nothing invoked or recorded)</li>
 *   <li>delegation to the active plugins ({@link DelegationFailureException}, performed steps are
 *       compensated and one FAILED entry is appended)</li>
 * </ol>
 * On success the state advances and one APPLIED entry is appended.
 * <p>
 * Records live in memory; {@link #persist()} writes them to the current project's config under
 * {@value #ASSETS_KEY}, from where the constructor and {@link #restore()} read them back.
 */
public final class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    public static final String ASSETS_KEY = "lifecycle.assets";
    /** Directory under the project root holding versioned asset files. */
    public static final String ASSETS_DIR_KEY = "lifecycle.assets_dir";
    /** Extension of the file created for an asset id without an element path. */
    public static final String FILE_EXTENSION_KEY = "lifecycle.file_extension";

    static final String DEFAULT_ASSETS_DIR = "assets";
    static final String DEFAULT_FILE_EXTENSION = ".usda";

    private static final TypeReference<List<AssetRecord>> RECORD_LIST = new TypeReference<List<AssetRecord>>() {
    };
    private static final TypeReference<List<Object>> PLAIN_LIST = new TypeReference<List<Object>>() {
    };

    private final LayeredConfig config;
    private final PluginSelector selector;
    private final Clock clock;
    private final String actor;
    private final Map<AssetId, AssetRecord> records = new TreeMap<>();

    public LifecycleManager(LayeredConfig config, PluginSelector selector) {
        this(config, selector, Clock.systemUTC(), System.getProperty("user.name", "unknown"));
    }

    /**
     * @throws LifecycleException when the current project holds malformed lifecycle records
     */
    public LifecycleManager(LayeredConfig config, PluginSelector selector, Clock clock, String actor) {
        this.config = Objects.requireNonNull(config, "config");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.actor = Objects.requireNonNull(actor, "actor");
        restore();
    }

    /** Registers a new asset in {@link GateState#IDEA}. */
    public synchronized AssetRecord createAsset(AssetId id, String name, String type) {
        Objects.requireNonNull(id, "id");
        if (records.containsKey(id)) {
            throw new IllegalArgumentException("Asset already exists: " + id);
        }
        AssetRecord record = AssetRecord.create(id, name, type);
        records.put(id, record);
        log.info("Created asset {} ({}) in {}", id, type, record.getState());
        return record;
    }

    public synchronized Optional<AssetRecord> get(AssetId id) {
        return Optional.ofNullable(records.get(id));
    }

    /** All assets, ordered by id. */
    public synchronized List<AssetRecord> assets() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    public synchronized List<AssetRecord> assetsIn(GateState state) {
        List<AssetRecord> out = new ArrayList<>();
        for (AssetRecord r : records.values()) {
            if (r.getState() == state) out.add(r);
        }
        return Collections.unmodifiableList(out);
    }

    /** Structurally legal targets from the asset's current state; gating is not evaluated. */
    public synchronized List<GateState> availableTransitions(AssetId id) {
        return require(id).getState().allowedTargets();
    }

    public AssetRecord transition(AssetId id, GateState target) {
        return transition(id, target, actor);
    }

    /**
     * Moves the asset to {@code target}.
     *
     * @return the updated record
     * @throws UnknownAssetException       when the asset was never created
     * @throws IllegalTransitionException  when {@code target} is not adjacent to the current state
     * @throws GatingViolationException    when a gating rule does not hold
     * @throws DelegationFailureException  when a required plugin is missing or fails
     */
    public synchronized AssetRecord transition(AssetId id, GateState target, String actor) {
        Objects.requireNonNull(target, "target");
        AssetRecord record = require(id);
        GateState from = record.getState();
        if (!from.canTransitionTo(target)) {
            throw new IllegalTransitionException(id, from, target);
        }

        EffectiveConfig effective = config.effective();
        List<String> rules = GatingRules.rulesFor(effective, from, target);
        List<String> unmet = GatingRules.unmet(rules, record, effective,
                selector.activePlugin(Capability.TASK_MANAGER, TaskManagerPlugin.class));
        if (!unmet.isEmpty()) {
            log.warn("Gate {} -> {} refused for {}: {}", from, target, id, unmet);
            throw new GatingViolationException(id, from, target, unmet);
        }

        Delegation delegation = new Delegation(record, from, target);
        try {
            delegation.perform(effective);
        } catch (DelegationFailureException e) {
            delegation.compensate(e);
            record.append(new TransitionEntry(clock.millis(), from, target, actor, delegation.invoked,
                    TransitionOutcome.FAILED, e.getReason()));
            log.error("Transition {} -> {} of {} failed: {}", from, target, id, e.getReason(), e);
            throw e;
        }

        delegation.commit();
        record.setState(target);
        String note = notifyTerminal(record, from, target, delegation.invoked);
        record.append(new TransitionEntry(clock.millis(), from, target, actor, delegation.invoked,
                TransitionOutcome.APPLIED, note));
        log.info("Asset {} moved {} -> {} by {}", id, from, target, actor);
        return record;
    }

    /**
     * Writes every record into the current project's config and saves that layer.
     *
     * @throws IllegalStateException when no project is current
     */
    public synchronized void persist() {
        Object plain = ConfigCodec.mapper().convertValue(new ArrayList<>(records.values()), PLAIN_LIST);
        config.set(ConfigScope.PROJECT, ASSETS_KEY, plain);
        config.save(ConfigScope.PROJECT);
        log.debug("Persisted {} asset records", records.size());
    }

    /**
     * Replaces the in-memory records with those stored in the current project. Without a current
     * project, or with nothing stored, the manager starts empty.
     *
     * @return number of restored records
     * @throws LifecycleException when the stored records are malformed; in-memory records are kept
     */
    public synchronized int restore() {
        ResolvedSetting stored = config.get(ConfigScope.PROJECT, ASSETS_KEY);
        if (!stored.isConfigured() || stored.getValue() == null) {
            records.clear();
            return 0;
        }
        List<AssetRecord> restored;
        try {
            restored = ConfigCodec.mapper().convertValue(stored.getValue(), RECORD_LIST);
        } catch (IllegalArgumentException e) {
            String project = config.currentProject().map(ProjectConfig::getName).orElse("?");
            throw new LifecycleException(null, "Malformed " + ASSETS_KEY + " in project " + project
                    + ": " + e.getMessage(), e);
        }
        records.clear();
        for (AssetRecord r : restored) {
            records.put(r.getId(), r);
        }
        log.info("Restored {} asset records", records.size());
        return records.size();
    }

    /** Workspace path of the versioned file for {@code id} under the current project. */
    public Optional<Path> versionedFileFor(AssetId id) {
        return config.currentProject().map(p -> versionedFileFor(id, p.getRootPath(), config.effective()));
    }

    static Path versionedFileFor(AssetId id, Path projectRoot, EffectiveConfig effective) {
        Path dir = projectRoot.resolve(effective.getString(ASSETS_DIR_KEY, DEFAULT_ASSETS_DIR));
        for (String segment : id.getSegments()) {
            dir = dir.resolve(segment);
        }
        String element = id.getSuffix().replaceFirst("[#@]\\d+$", "");
        if (element.isEmpty()) {
            return dir.resolve(id.getName() + effective.getString(FILE_EXTENSION_KEY, DEFAULT_FILE_EXTENSION));
        }
        return dir.resolve(element);
    }

    private AssetRecord require(AssetId id) {
        Objects.requireNonNull(id, "id");
        AssetRecord record = records.get(id);
        if (record == null) {
            throw new UnknownAssetException(id);
        }
        return record;
    }

    /** Notifies the active notification plugin of a final state. Returns a note when delivery failed. */
    private String notifyTerminal(AssetRecord record, GateState from, GateState to, List<String> invoked) {
        if (to != GateState.PRODUCTION_READY && to != GateState.REJECTED) {
            return null;
        }
        Optional<PluginDescriptor> descriptor = selector.active(Capability.NOTIFICATION_SYSTEM);
        Optional<NotificationPlugin> notifier = descriptor.flatMap(d -> d.getPlugin(NotificationPlugin.class));
        if (notifier.isEmpty()) {
            return null;
        }
        invoked.add(descriptor.get().getId().toString());
        try {
            notifier.get().notify("Asset " + to, record.getId() + " (" + record.getName() + ") moved "
                    + from + " -> " + to);
            return null;
        } catch (RuntimeException e) {
            log.warn("Notification for {} failed in {}", record.getId(), descriptor.get().getId(), e);
            return "Notification failed: " + reasonOf(e);
        }
    }

    private static String reasonOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    /** Undo action for a performed step. */
    private interface Compensation {
        void run() throws Exception;
    }

    /** Plugin steps of one transition, with their undo actions. */
    private final class Delegation {

        private final AssetRecord record;
        private final GateState from;
        private final GateState to;
        private final List<String> invoked = new ArrayList<>();
        private final Deque<Compensation> undo = new ArrayDeque<>();
        private Path versionedFile;
        private String linkedTask;

        Delegation(AssetRecord record, GateState from, GateState to) {
            this.record = record;
            this.from = from;
            this.to = to;
        }

        /**
         * Runs the plugin steps of the transition. Any failure, including one while preparing a step
         * (e.g. an unusable versioned-file path), surfaces as a {@link DelegationFailureException}.
         */
        void perform(EffectiveConfig effective) {
            try {
                switch (to) {
                    case IN_DEVELOPMENT:
                        startDevelopment(effective);
                        break;
                    case REVIEW:
                        submitForReview(effective);
                        break;
                    default:
                        break;
                }
            } catch (DelegationFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DelegationFailureException(record.getId(), from, to, null, reasonOf(e), e);
            }
        }

        private void startDevelopment(EffectiveConfig effective) {
            PluginDescriptor fmDescriptor = required(Capability.FILE_MANAGER);
            PluginDescriptor tmDescriptor = required(Capability.TASK_MANAGER);
            FileManagerPlugin files = fmDescriptor.getPlugin(FileManagerPlugin.class).orElseThrow();
            TaskManagerPlugin tasks = tmDescriptor.getPlugin(TaskManagerPlugin.class).orElseThrow();
            Path file = fileLocation(effective);
            String assetId = record.getId().toString();

            call(fmDescriptor, () -> {
                files.checkout(file);
                return null;
            });
            undo.push(() -> files.revert(file));
            String taskId = call(tmDescriptor, () -> tasks.create(new TaskSpec(
                    "Develop " + record.getName(),
                    "Development of " + (record.getType() != null ? record.getType() + " " : "") + assetId,
                    assetId)));
            call(tmDescriptor, () -> {
                tasks.link(assetId, taskId);
                return null;
            });
            versionedFile = file;
            linkedTask = taskId;
        }

        private void submitForReview(EffectiveConfig effective) {
            PluginDescriptor fmDescriptor = required(Capability.FILE_MANAGER);
            FileManagerPlugin files = fmDescriptor.getPlugin(FileManagerPlugin.class).orElseThrow();
            Path file = record.getVersionedFile() != null ? Path.of(record.getVersionedFile()) : fileLocation(effective);
            call(fmDescriptor, () -> {
                files.submit(file, "Submit " + record.getId() + " for review");
                return null;
            });
            versionedFile = file;
        }

        private PluginDescriptor required(Capability capability) {
            Optional<PluginDescriptor> descriptor = selector.active(capability);
            if (descriptor.isEmpty() || descriptor.get().getPlugin(capability.getContract()).isEmpty()) {
                throw new DelegationFailureException(record.getId(), from, to, null,
                        "No active " + capability + " plugin", null);
            }
            return descriptor.get();
        }

        private Path fileLocation(EffectiveConfig effective) {
            Optional<ProjectConfig> project = config.currentProject();
            if (project.isEmpty()) {
                throw new DelegationFailureException(record.getId(), from, to, null,
                        "No current project to hold the versioned file", null);
            }
            return versionedFileFor(record.getId(), project.get().getRootPath(), effective);
        }

        private <T> T call(PluginDescriptor descriptor, Callable<T> step) {
            String pluginId = descriptor.getId().toString();
            if (!invoked.contains(pluginId)) invoked.add(pluginId);
            try {
                return step.call();
            } catch (Exception e) {
                throw new DelegationFailureException(record.getId(), from, to, pluginId, reasonOf(e), e);
            }
        }

        /** Runs undo actions newest first; their failures are attached to {@code failure}. */
        void compensate(DelegationFailureException failure) {
            while (!undo.isEmpty()) {
                try {
                    undo.pop().run();
                } catch (Exception e) {
                    failure.addSuppressed(e);
                    log.warn("Compensation after failed {} -> {} of {} failed", from, to, record.getId(), e);
                }
            }
        }

        void commit() {
            if (versionedFile != null) record.setVersionedFile(versionedFile.toString());
            if (linkedTask != null) record.addLinkedTask(linkedTask);
        }
    }
}
