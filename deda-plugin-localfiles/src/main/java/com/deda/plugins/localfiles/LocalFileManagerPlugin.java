package com.deda.plugins.localfiles;

import com.deda.annotations.ResourceCleanup;
import com.deda.plugin.FileManagerPlugin;
import com.deda.plugin.PluginContext;
import com.deda.plugin.Revision;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * File manager that keeps revisions in a depot directory (local disk or a network share).
 * <p>
 * Each workspace file maps to a depot entry directory named after its path relative to the project
 * root: {@code <depot>/<relative path>/} holding {@code rev-0001}, {@code rev-0002}, ... and a
 * {@code history.json}. Open files carry an {@code .edit} or {@code .add} marker in the entry.
 * <p>
 * Depot location: setting {@value #ROOT_KEY}, which must point at an existing writable directory;
 * otherwise {@code <projectRoot>/.dedaverse/depot}, created on load.
 */
public final class LocalFileManagerPlugin implements FileManagerPlugin, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(LocalFileManagerPlugin.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<List<Revision>> HISTORY_TYPE = new TypeReference<List<Revision>>() {
    };

    /** Setting naming the depot directory. */
    public static final String ROOT_KEY = "localfiles.root";
    static final String HISTORY_FILE = "history.json";
    static final String EDIT_MARKER = ".edit";
    static final String ADD_MARKER = ".add";

    private final Clock clock;
    private final String user;
    private volatile Path depotRoot;
    private volatile Path workspaceRoot;

    public LocalFileManagerPlugin() {
        this(Clock.systemUTC(), System.getProperty("user.name"));
    }

    LocalFileManagerPlugin(Clock clock, String user) {
        this.clock = clock;
        this.user = user;
    }

    @Override
    public void load(PluginContext context) throws IOException {
        String configured = context.getSetting(ROOT_KEY).asString(null);
        Path projectRoot = context.getProjectRoot().orElse(null);
        Path root;
        if (configured != null && !configured.isBlank()) {
            root = Paths.get(configured.trim()).toAbsolutePath().normalize();
            if (!Files.isDirectory(root) || !Files.isWritable(root)) {
                throw new IOException("Depot root is not reachable: " + root);
            }
        } else if (projectRoot != null) {
            root = projectRoot.resolve(".dedaverse").resolve("depot").toAbsolutePath().normalize();
            Files.createDirectories(root);
        } else {
            throw new IOException("No depot configured: set " + ROOT_KEY + " or select a project");
        }
        this.depotRoot = root;
        this.workspaceRoot = projectRoot != null ? projectRoot.toAbsolutePath().normalize() : null;
        log.info("Local depot at {}", root);
    }

    Path getDepotRoot() {
        return depotRoot;
    }

    /**
     * Opens {@code path} for edit. A file that was never submitted is opened for add; a versioned file
     * missing from the workspace is restored from its latest revision.
     */
    @Override
    public synchronized void checkout(Path path) throws IOException {
        Path entry = entryFor(path);
        List<Revision> revisions = readHistory(entry);
        if (revisions.isEmpty()) {
            if (!Files.exists(entry.resolve(ADD_MARKER))) {
                markOpen(entry, ADD_MARKER);
                log.info("Opened {} for add", path);
            }
            return;
        }
        if (!Files.exists(path)) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.copy(revisionFile(entry, revisions.get(revisions.size() - 1).getNumber()), path);
        }
        if (!Files.exists(entry.resolve(EDIT_MARKER))) {
            markOpen(entry, EDIT_MARKER);
            log.info("Opened {} for edit", path);
        }
    }

    @Override
    public synchronized void submit(Path path, String description) throws IOException {
        Path entry = entryFor(path);
        if (!Files.exists(entry.resolve(EDIT_MARKER)) && !Files.exists(entry.resolve(ADD_MARKER))) {
            throw new IOException("Cannot submit " + path + ": file is not opened for edit or add");
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Cannot submit " + path + ": file does not exist");
        }
        List<Revision> revisions = new ArrayList<>(readHistory(entry));
        int number = revisions.size() + 1;
        Files.copy(path, revisionFile(entry, number), StandardCopyOption.REPLACE_EXISTING);
        revisions.add(new Revision(number, description, user, clock.millis()));
        writeHistory(entry, revisions);
        Files.deleteIfExists(entry.resolve(EDIT_MARKER));
        Files.deleteIfExists(entry.resolve(ADD_MARKER));
        log.info("Submitted {} as revision {}", path, number);
    }

    @Override
    public synchronized List<Revision> history(Path path) throws IOException {
        List<Revision> revisions = new ArrayList<>(readHistory(entryFor(path)));
        Collections.reverse(revisions);
        return Collections.unmodifiableList(revisions);
    }

    @Override
    public synchronized void add(Path path) throws IOException {
        Path entry = entryFor(path);
        if (!readHistory(entry).isEmpty()) {
            throw new IOException("Cannot add " + path + ": file is already under version control");
        }
        markOpen(entry, ADD_MARKER);
        log.info("Opened {} for add", path);
    }

    @Override
    public synchronized void revert(Path path) throws IOException {
        Path entry = entryFor(path);
        List<Revision> revisions = readHistory(entry);
        boolean editing = Files.deleteIfExists(entry.resolve(EDIT_MARKER));
        boolean adding = Files.deleteIfExists(entry.resolve(ADD_MARKER));
        if (editing && !revisions.isEmpty()) {
            Files.copy(revisionFile(entry, revisions.get(revisions.size() - 1).getNumber()), path,
                    StandardCopyOption.REPLACE_EXISTING);
        }
        if (adding && revisions.isEmpty()) {
            try (Stream<Path> contents = Files.list(entry)) {
                if (contents.findAny().isEmpty()) Files.delete(entry);
            }
        }
        if (editing || adding) {
            log.info("Reverted {}", path);
        }
    }

    /** Whether {@code path} is currently opened for edit or add. */
    public synchronized boolean isOpened(Path path) throws IOException {
        Path entry = entryFor(path);
        return Files.exists(entry.resolve(EDIT_MARKER)) || Files.exists(entry.resolve(ADD_MARKER));
    }

    @Override
    public void onExit() {
        depotRoot = null;
        workspaceRoot = null;
    }

    private Path entryFor(Path path) throws IOException {
        Path root = depotRoot;
        if (root == null) {
            throw new IOException("Local depot is not loaded");
        }
        Path workspace = workspaceRoot;
        if (workspace == null) {
            throw new IOException("No workspace to version " + path + ": select a project");
        }
        Path abs = path.toAbsolutePath().normalize();
        if (!abs.startsWith(workspace)) {
            throw new IOException(path + " is outside the workspace " + workspace);
        }
        Path relative = workspace.relativize(abs);
        if (relative.toString().isEmpty()) {
            throw new IOException("Not a file path: " + path);
        }
        return root.resolve(relative.toString());
    }

    private static Path revisionFile(Path entry, int number) {
        return entry.resolve(String.format("rev-%04d", number));
    }

    private void markOpen(Path entry, String marker) throws IOException {
        Files.createDirectories(entry);
        Files.writeString(entry.resolve(marker), user != null ? user : "", StandardCharsets.UTF_8);
    }

    private static List<Revision> readHistory(Path entry) throws IOException {
        Path file = entry.resolve(HISTORY_FILE);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        return MAPPER.readValue(file.toFile(), HISTORY_TYPE);
    }

    private static void writeHistory(Path entry, List<Revision> revisions) throws IOException {
        Files.createDirectories(entry);
        MAPPER.writeValue(entry.resolve(HISTORY_FILE).toFile(), revisions);
    }
}
