package com.deda.plugin;

import java.util.Objects;

/**
 * What to create in the task tracker: title, description and the asset the task belongs to.
 */
public final class TaskSpec {

    private final String title;
    private final String description;
    private final String assetId;
    private final String assignee;

    public TaskSpec(String title, String description, String assetId, String assignee) {
        this.title = Objects.requireNonNull(title, "title");
        this.description = description != null ? description : "";
        this.assetId = assetId;
        this.assignee = assignee;
    }

    public TaskSpec(String title, String description, String assetId) {
        this(title, description, assetId, null);
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    /** Asset id the task is for, or null. */
    public String getAssetId() {
        return assetId;
    }

    /** Assignee, or null when unassigned. */
    public String getAssignee() {
        return assignee;
    }

    @Override
    public String toString() {
        return "TaskSpec[" + title + (assetId != null ? ", " + assetId : "") + "]";
    }
}
