package com.deda.plugin;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Versioned file storage (Perforce, a network depot, ...). Paths are workspace paths; the backend
 * maps them to its own storage.
 */
public interface FileManagerPlugin extends Plugin {

    /** Whether this backend manages {@code path}. Default: every path. */
    default boolean canHandle(Path path) {
        return true;
    }

    /** Opens {@code path} for edit, syncing the latest revision into the workspace if it is missing. */
    void checkout(Path path) throws IOException;

    /**
     * Records the workspace content of {@code path} as a new revision and releases the checkout.
     *
     * @throws IOException when the file is missing or the backend rejects the submit
     */
    void submit(Path path, String description) throws IOException;

    /** Revisions of {@code path}, newest first; empty when the file was never submitted. */
    List<Revision> history(Path path) throws IOException;

    /** Marks a new file for add; it becomes versioned on the next submit. */
    void add(Path path) throws IOException;

    /** Discards a checkout or pending add, restoring the latest revision where one exists. */
    void revert(Path path) throws IOException;
}
