package com.deda.plugins.localtasks;

import com.deda.annotations.ResourceCleanup;
import com.deda.plugin.PluginContext;
import com.deda.plugin.TaskManagerPlugin;
import com.deda.plugin.TaskSpec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task manager backed by a JSON file: {@code <projectRoot>/.dedaverse/tasks.json} unless the setting
 * {@value #FILE_KEY} names another file. Tasks get ids {@code TASK-1}, {@code TASK-2}, ... and start
 * in status {@value #STATUS_OPEN}. Every change is written through.
 */
public final class LocalTaskManagerPlugin implements TaskManagerPlugin, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(LocalTaskManagerPlugin.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<List<TaskRecord>> TASKS_TYPE = new TypeReference<List<TaskRecord>>() {
    };

    /** Setting naming the task store file. */
    public static final String FILE_KEY = "localtasks.file";
    public static final String STATUS_OPEN = "open";
    static final String ID_PREFIX = "TASK-";

    private final Clock clock;
    private final Map<String, TaskRecord> tasks = new LinkedHashMap<>();
    private Path storeFile;

    public LocalTaskManagerPlugin() {
        this(Clock.systemUTC());
    }

    LocalTaskManagerPlugin(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void load(PluginContext context) throws IOException {
        String configured = context.getSetting(FILE_KEY).asString(null);
        Path file;
        if (configured != null && !configured.isBlank()) {
            file = Paths.get(configured.trim());
        } else {
            file = context.getProjectRoot()
                    .map(root -> root.resolve(".dedaverse").resolve("tasks.json"))
                    .orElseThrow(() -> new IOException("No task store configured: set " + FILE_KEY + " or select a project"));
        }
        tasks.clear();
        if (Files.isRegularFile(file)) {
            for (TaskRecord task : MAPPER.readValue(file.toFile(), TASKS_TYPE)) {
                tasks.put(task.getId(), task);
            }
        }
        this.storeFile = file;
        log.info("Task store {} loaded with {} task(s)", file, tasks.size());
    }

    @Override
    public synchronized String create(TaskSpec spec) throws IOException {
        requireLoaded();
        String id = ID_PREFIX + nextNumber();
        TaskRecord task = new TaskRecord(id, spec.getTitle(), spec.getDescription(), spec.getAssignee(),
                STATUS_OPEN, clock.millis(), null);
        if (spec.getAssetId() != null) {
            task.link(spec.getAssetId());
        }
        tasks.put(id, task);
        write();
        log.info("Created task {}: {}", id, spec.getTitle());
        return id;
    }

    @Override
    public synchronized void link(String assetId, String taskId) throws IOException {
        require(taskId).link(assetId);
        write();
    }

    @Override
    public synchronized String status(String taskId) throws IOException {
        return require(taskId).getStatus();
    }

    /** Changes a task's status (e.g. when the artist finishes it). */
    public synchronized void setStatus(String taskId, String status) throws IOException {
        require(taskId).setStatus(status);
        write();
    }

    public synchronized Optional<TaskRecord> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public synchronized List<TaskRecord> tasks() {
        return List.copyOf(tasks.values());
    }

    @Override
    public synchronized void onExit() {
        tasks.clear();
        storeFile = null;
    }

    private int nextNumber() {
        int max = 0;
        for (String id : tasks.keySet()) {
            if (id.startsWith(ID_PREFIX)) {
                try {
                    max = Math.max(max, Integer.parseInt(id.substring(ID_PREFIX.length())));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric task id {}", id);
                }
            }
        }
        return max + 1;
    }

    private TaskRecord require(String taskId) throws IOException {
        requireLoaded();
        TaskRecord task = tasks.get(taskId);
        if (task == null) {
            throw new IOException("Unknown task: " + taskId);
        }
        return task;
    }

    private void requireLoaded() throws IOException {
        if (storeFile == null) {
            throw new IOException("Task store is not loaded");
        }
    }

    private void write() throws IOException {
        Path parent = storeFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(storeFile.toFile(), new ArrayList<>(tasks.values()));
    }
}
