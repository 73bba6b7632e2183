package com.deda.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lifecycle state of one asset: gate, versioned file, linked tasks and transition history.
 * Mutated only by {@link LifecycleManager}; callers see read-only views.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AssetRecord {

    private final AssetId id;
    private final String name;
    private final String type;
    private GateState state;
    private String versionedFile;
    private final List<String> linkedTasks;
    private final List<TransitionEntry> history;

    @JsonCreator
    public AssetRecord(
            @JsonProperty("id") AssetId id,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("state") GateState state,
            @JsonProperty("versionedFile") String versionedFile,
            @JsonProperty("linkedTasks") List<String> linkedTasks,
            @JsonProperty("history") List<TransitionEntry> history) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id.getName();
        this.type = type;
        this.state = state != null ? state : GateState.IDEA;
        this.versionedFile = versionedFile;
        this.linkedTasks = linkedTasks != null ? new ArrayList<>(linkedTasks) : new ArrayList<>();
        this.history = history != null ? new ArrayList<>(history) : new ArrayList<>();
    }

    static AssetRecord create(AssetId id, String name, String type) {
        return new AssetRecord(id, name, type, GateState.IDEA, null, null, null);
    }

    public AssetId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public GateState getState() {
        return state;
    }

    /** Workspace path of the versioned file, once a file manager has opened it. */
    public String getVersionedFile() {
        return versionedFile;
    }

    public List<String> getLinkedTasks() {
        return Collections.unmodifiableList(linkedTasks);
    }

    public List<TransitionEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    @JsonIgnore
    public TransitionEntry getLastEntry() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    void setState(GateState state) {
        this.state = state;
    }

    void setVersionedFile(String versionedFile) {
        this.versionedFile = versionedFile;
    }

    void addLinkedTask(String taskId) {
        if (!linkedTasks.contains(taskId)) linkedTasks.add(taskId);
    }

    void append(TransitionEntry entry) {
        history.add(entry);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((AssetRecord) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id + " [" + state + "]";
    }
}
