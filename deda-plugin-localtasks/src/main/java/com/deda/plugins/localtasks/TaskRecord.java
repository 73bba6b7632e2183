package com.deda.plugins.localtasks;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stored task: id, title, description, assignee, status and the assets linked to it.
 */
public final class TaskRecord {

    private final String id;
    private final String title;
    private final String description;
    private final String assignee;
    private final long createdAtMillis;
    private final List<String> linkedAssets;
    private volatile String status;

    @JsonCreator
    TaskRecord(@JsonProperty("id") String id,
               @JsonProperty("title") String title,
               @JsonProperty("description") String description,
               @JsonProperty("assignee") String assignee,
               @JsonProperty("status") String status,
               @JsonProperty("createdAtMillis") long createdAtMillis,
               @JsonProperty("linkedAssets") List<String> linkedAssets) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.assignee = assignee;
        this.status = status;
        this.createdAtMillis = createdAtMillis;
        this.linkedAssets = linkedAssets != null ? new ArrayList<>(linkedAssets) : new ArrayList<>();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getAssignee() {
        return assignee;
    }

    public String getStatus() {
        return status;
    }

    public long getCreatedAtMillis() {
        return createdAtMillis;
    }

    public List<String> getLinkedAssets() {
        return Collections.unmodifiableList(linkedAssets);
    }

    void setStatus(String status) {
        this.status = status;
    }

    void link(String assetId) {
        if (!linkedAssets.contains(assetId)) {
            linkedAssets.add(assetId);
        }
    }
}
