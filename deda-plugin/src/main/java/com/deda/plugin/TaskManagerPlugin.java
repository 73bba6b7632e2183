package com.deda.plugin;

import java.io.IOException;

/**
 * External task tracking (Jira, ShotGrid, ...).
 */
public interface TaskManagerPlugin extends Plugin {

    /**
     * Creates a task.
     *
     * @return the backend's id for the new task
     */
    String create(TaskSpec spec) throws IOException;

    /** Associates an existing task with an asset. */
    void link(String assetId, String taskId) throws IOException;

    /**
     * Backend status of a task (e.g. {@code open}, {@code in-progress}, {@code done}).
     *
     * @throws IOException when the task is unknown or the backend cannot be reached
     */
    String status(String taskId) throws IOException;
}
