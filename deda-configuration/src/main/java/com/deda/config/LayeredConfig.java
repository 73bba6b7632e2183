package com.deda.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Configuration context composing the site, user and current-project layers into one effective view.
 * <p>
 * Reads resolve Project over User over Site. Writes go only to the scope passed; there is no
 * implicit "most specific layer". Each layer is loaded lazily on first access and cached; the
 * merged view is cached until a layer is mutated or reloaded.
 * <p>
 * Construct one per process and pass it to the components that need it. {@link #getDefault()}
 * holds the process-level instance installed at start-up for callers without injection.
 * <p>
 * <b>Threading:</b> {@code set}, {@code remove}, {@code save} and {@code reload} take a per-scope
 * write lock. Reads of the merged view take no lock; each mutation publishes a new snapshot.
 */
public final class LayeredConfig {

    private static final Logger log = LoggerFactory.getLogger(LayeredConfig.class);

    /** Setting listing extra plugin search paths (list of strings, any layer). */
    public static final String PLUGIN_DIRS_KEY = "plugin_dirs";

    private static volatile LayeredConfig defaultInstance;

    private final ConfigLocations locations;
    private final Clock clock;
    private final LayerStore store = new LayerStore();
    private final Map<ConfigScope, ReentrantLock> writeLocks = new EnumMap<>(ConfigScope.class);
    /** Loaded project layers by identity; a project stays cached while its settings change. */
    private final Map<ScopeKey, ProjectConfig> loadedProjects = new ConcurrentHashMap<>();
    private final Map<ScopeKey, ConfigParseException> loadErrors = new ConcurrentHashMap<>();
    /** Layers whose file was malformed at start-up and that run on defaults until reloaded. */
    private final Set<ScopeKey> startedFromDefaults = ConcurrentHashMap.newKeySet();
    private final AtomicLong generation = new AtomicLong();

    private volatile SiteConfig site;
    private volatile UserConfig user;
    private volatile Snapshot snapshot;

    public LayeredConfig(ConfigLocations locations) {
        this(locations, Clock.systemUTC());
    }

    public LayeredConfig(ConfigLocations locations, Clock clock) {
        this.locations = Objects.requireNonNull(locations, "locations");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (ConfigScope scope : ConfigScope.values()) {
            writeLocks.put(scope, new ReentrantLock());
        }
    }

    /**
     * Process-level instance. Created from the environment on first call unless
     * {@link #setDefault(LayeredConfig)} installed one at start-up.
     */
    public static LayeredConfig getDefault() {
        LayeredConfig inst = defaultInstance;
        if (inst == null) {
            synchronized (LayeredConfig.class) {
                if (defaultInstance == null) {
                    defaultInstance = new LayeredConfig(ConfigLocations.fromEnvironment());
                }
                inst = defaultInstance;
            }
        }
        return inst;
    }

    /** Installs (or with null, clears) the process-level instance. */
    public static void setDefault(LayeredConfig config) {
        synchronized (LayeredConfig.class) {
            defaultInstance = config;
        }
    }

    public ConfigLocations getLocations() {
        return locations;
    }

    // --- layers ---

    /**
     * Site layer, loaded on first access. With no site file configured this is an empty in-memory layer.
     *
     * @throws ConfigParseException if the site file exists but is malformed
     */
    public SiteConfig site() {
        SiteConfig s = site;
        if (s != null) return s;
        ReentrantLock lock = writeLocks.get(ConfigScope.SITE);
        lock.lock();
        try {
            if (site == null) {
                site = loadSite();
            }
            return site;
        } finally {
            lock.unlock();
        }
    }

    /**
     * User layer, loaded on first access.
     *
     * @throws ConfigParseException if the user file exists but is malformed
     */
    public UserConfig user() {
        UserConfig u = user;
        if (u != null) return u;
        ReentrantLock lock = writeLocks.get(ConfigScope.USER);
        lock.lock();
        try {
            if (user == null) {
                user = loadUser();
            }
            return user;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The project the user is working on, loaded from its root on first access. A known project
     * without a config file yet gets a default layer.
     *
     * @return current project, or empty when none is selected
     */
    public Optional<ProjectConfig> currentProject() {
        UserConfig u = user();
        String name = u.getCurrentProject();
        if (name == null) return Optional.empty();
        String root = u.getProjects().get(name);
        if (root == null) {
            log.warn("Current project {} is not in the user's project list; no project layer is active", name);
            return Optional.empty();
        }
        return Optional.of(projectAt(name, Paths.get(root)));
    }

    /**
     * Makes {@code project} current and adds it to the user's known projects. When a config file
     * already exists at the project root it is loaded instead of the passed defaults. The user
     * layer is changed in memory only; call {@link #save(ConfigScope)} to persist it.
     */
    public ProjectConfig setCurrentProject(ProjectConfig project) {
        Objects.requireNonNull(project, "project");
        ProjectConfig active = register(project);
        UserConfig u = user();
        ReentrantLock lock = writeLocks.get(ConfigScope.USER);
        lock.lock();
        try {
            u.putProject(active.getName(), active.getRootDir());
            u.setCurrentProject(active.getName());
        } finally {
            lock.unlock();
        }
        invalidate();
        log.info("Current project set to {} ({})", active.getName(), active.getRootDir());
        return active;
    }

    /** Adds a project to the user's known projects without making it current. */
    public ProjectConfig addProject(ProjectConfig project) {
        Objects.requireNonNull(project, "project");
        ProjectConfig active = register(project);
        UserConfig u = user();
        ReentrantLock lock = writeLocks.get(ConfigScope.USER);
        lock.lock();
        try {
            u.putProject(active.getName(), active.getRootDir());
        } finally {
            lock.unlock();
        }
        return active;
    }

    /**
     * All projects known to the user, loading each on demand. Projects whose config file is
     * malformed are left out and reported through {@link #getLoadErrors()}.
     */
    public List<ProjectConfig> projects() {
        List<ProjectConfig> out = new ArrayList<>();
        // copy: loading a project may rename its entry in the user layer
        for (Map.Entry<String, String> e : new LinkedHashMap<>(user().getProjects()).entrySet()) {
            try {
                out.add(projectAt(e.getKey(), Paths.get(e.getValue())));
            } catch (ConfigParseException ex) {
                log.warn("Skipping project {}: {}", e.getKey(), ex.getMessage());
            }
        }
        return Collections.unmodifiableList(out);
    }

    public Optional<ProjectConfig> getProject(String name) {
        return projects().stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    /**
     * Loads the site, user and current-project layers at start-up. A layer whose file is malformed
     * starts from defaults instead of failing: the error is logged and kept in
     * {@link #getLoadErrors()}, the remaining layers still load, and the layer refuses
     * {@link #save(ConfigScope)} (which would overwrite the broken file) until a {@link #reload}
     * succeeds. Layers already loaded are left as they are.
     *
     * @return parse failures by layer, empty when every layer loaded cleanly
     */
    public Map<ScopeKey, ConfigParseException> loadLayers() {
        withWriteLock(ConfigScope.SITE, () -> {
            if (site == null) {
                try {
                    site = loadSite();
                } catch (ConfigParseException e) {
                    site = SiteConfig.defaults(siteKey());
                    startFromDefaults(site.getScopeKey());
                }
            }
        });
        withWriteLock(ConfigScope.USER, () -> {
            if (user == null) {
                try {
                    user = loadUser();
                } catch (ConfigParseException e) {
                    user = UserConfig.defaults(userKey());
                    startFromDefaults(user.getScopeKey());
                }
            }
        });
        String name = user.getCurrentProject();
        String root = name != null ? user.getProjects().get(name) : null;
        if (root != null) {
            try {
                projectAt(name, Paths.get(root));
            } catch (ConfigParseException e) {
                ProjectConfig fallback = ProjectConfig.create(name, Paths.get(root));
                loadedProjects.putIfAbsent(fallback.getScopeKey(), fallback);
                startFromDefaults(fallback.getScopeKey());
            }
        }
        invalidate();
        return getLoadErrors();
    }

    // --- reads ---

    /**
     * Value of {@code key} in one layer only, with no fall-through.
     */
    public ResolvedSetting get(ConfigScope scope, String key) {
        Objects.requireNonNull(key, "key");
        Optional<LayerConfig> layer = layer(scope);
        if (layer.isEmpty() || !layer.get().contains(key)) {
            return ResolvedSetting.notConfigured(key);
        }
        return ResolvedSetting.of(key, layer.get().getSettings().get(key), scope);
    }

    /** Value of {@code key} from the effective view (Project over User over Site). */
    public ResolvedSetting resolve(String key) {
        return effective().get(key);
    }

    /**
     * Merged view of all layers. Cached until the next mutation or reload; never locks.
     */
    public EffectiveConfig effective() {
        long gen = generation.get();
        Snapshot s = snapshot;
        if (s != null && s.generation == gen) {
            return s.view;
        }
        EffectiveConfig view = EffectiveConfig.merge(site(), user(), currentProject().orElse(null));
        snapshot = new Snapshot(gen, view);
        return view;
    }

    /** Merged plugin references; one per plugin name. */
    public List<PluginRef> activePluginRefs() {
        return effective().getPluginRefs();
    }

    /**
     * Plugin search paths: environment paths first, then the effective {@value #PLUGIN_DIRS_KEY}
     * setting, without duplicates.
     */
    public List<Path> pluginDirs() {
        Set<Path> dirs = new LinkedHashSet<>(locations.getPluginDirs());
        for (String dir : effective().getStringList(PLUGIN_DIRS_KEY)) {
            if (!dir.isBlank()) dirs.add(Paths.get(dir.trim()));
        }
        return List.copyOf(dirs);
    }

    /** Parse failures from lazy loads and reloads, by layer; cleared when the layer loads cleanly. */
    public Map<ScopeKey, ConfigParseException> getLoadErrors() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(loadErrors));
    }

    // --- writes ---

    /**
     * Sets {@code key} in exactly the given layer. The value is stored in the form it will have after
     * a save and reload (a {@code long} that fits reads back as an {@code Integer}, a {@code float}
     * as a {@code Double}, beans as maps).
     *
     * @throws IllegalArgumentException when the value cannot be written as JSON
     * @throws IllegalStateException when {@code scope} is PROJECT and no project is current
     */
    public void set(ConfigScope scope, String key, Object value) {
        LayerConfig layer = requireLayer(scope);
        Object stored = ConfigCodec.toJsonValue(value);
        withWriteLock(scope, () -> layer.put(key, stored));
        invalidate();
        log.debug("Set {}.{}", scope, key);
    }

    /** Removes {@code key} from the given layer; lower layers become visible again. */
    public boolean remove(ConfigScope scope, String key) {
        LayerConfig layer = requireLayer(scope);
        boolean[] removed = new boolean[1];
        withWriteLock(scope, () -> removed[0] = layer.remove(key));
        if (removed[0]) invalidate();
        return removed[0];
    }

    /** Adds or replaces (by plugin name) a plugin reference in the given layer. */
    public void setPluginRef(ConfigScope scope, PluginRef ref) {
        LayerConfig layer = requireLayer(scope);
        withWriteLock(scope, () -> layer.putPlugin(ref));
        invalidate();
    }

    public boolean removePluginRef(ConfigScope scope, String pluginName) {
        LayerConfig layer = requireLayer(scope);
        boolean[] removed = new boolean[1];
        withWriteLock(scope, () -> removed[0] = layer.removePlugin(pluginName));
        if (removed[0]) invalidate();
        return removed[0];
    }

    /** Adds or replaces (by name and version) an app in the given layer. */
    public void setApp(ConfigScope scope, AppConfig app) {
        LayerConfig layer = requireLayer(scope);
        withWriteLock(scope, () -> layer.putApp(app));
        invalidate();
    }

    public boolean removeApp(ConfigScope scope, String name, String version) {
        LayerConfig layer = requireLayer(scope);
        boolean[] removed = new boolean[1];
        withWriteLock(scope, () -> removed[0] = layer.removeApp(name, version));
        if (removed[0]) invalidate();
        return removed[0];
    }

    /**
     * Sets (or with null rules, clears) a gating-rule override on the current project.
     *
     * @param transitionKey {@code FROM->TO} or a target state name
     */
    public void setGatingRule(String transitionKey, List<String> rules) {
        ProjectConfig project = (ProjectConfig) requireLayer(ConfigScope.PROJECT);
        withWriteLock(ConfigScope.PROJECT, () -> project.putGatingRule(transitionKey, rules));
        invalidate();
    }

    /** Replaces the operator's production roles in the user layer. */
    public void setRoles(List<String> roles) {
        UserConfig u = user();
        withWriteLock(ConfigScope.USER, () -> u.setRoles(roles));
        invalidate();
    }

    /**
     * Writes the given layer to its backing file and stamps its save time.
     *
     * @throws IllegalStateException when the layer has no backing file (site without
     *                               {@code DEDAVERSE_SITE_CONFIG}, or no current project), or when
     *                               the layer failed to load at start-up and has not been reloaded
     */
    public void save(ConfigScope scope) {
        LayerConfig layer = requireLayer(scope);
        if (startedFromDefaults.contains(layer.getScopeKey())) {
            throw new IllegalStateException("Configuration for " + layer.getScopeKey()
                    + " failed to load and is running on defaults; reload it before saving");
        }
        Path file = fileFor(layer);
        withWriteLock(scope, () -> {
            long previous = layer.getSavedAtMillis();
            layer.markSaved(clock.millis());
            try {
                store.save(file, layer);
            } catch (RuntimeException e) {
                layer.markSaved(previous);
                throw e;
            }
        });
    }

    /**
     * Re-reads one layer from its backing file, leaving other layers untouched, and invalidates the
     * merged view. A missing file resets the layer to defaults.
     *
     * @return the reloaded layer
     * @throws ConfigParseException if the file is malformed; the previously cached layer stays in effect
     * @throws IllegalStateException when reloading PROJECT with no current project
     */
    public LayerConfig reload(ConfigScope scope) {
        LayerConfig reloaded;
        switch (scope) {
            case SITE: {
                ReentrantLock lock = writeLocks.get(ConfigScope.SITE);
                lock.lock();
                try {
                    site = loadSite();
                    reloaded = site;
                } finally {
                    lock.unlock();
                }
                break;
            }
            case USER: {
                ReentrantLock lock = writeLocks.get(ConfigScope.USER);
                lock.lock();
                try {
                    user = loadUser();
                    reloaded = user;
                } finally {
                    lock.unlock();
                }
                break;
            }
            case PROJECT: {
                ProjectConfig current = currentProject().orElseThrow(() ->
                        new IllegalStateException("No current project to reload"));
                ReentrantLock lock = writeLocks.get(ConfigScope.PROJECT);
                lock.lock();
                try {
                    ProjectConfig fresh = loadProject(current.getName(), current.getRootPath());
                    loadedProjects.put(fresh.getScopeKey(), fresh);
                    reloaded = fresh;
                } finally {
                    lock.unlock();
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown scope: " + scope);
        }
        invalidate();
        log.info("Reloaded {} configuration from {}", scope, reloaded.getScopeKey());
        return reloaded;
    }

    // --- internals ---

    private Optional<LayerConfig> layer(ConfigScope scope) {
        switch (Objects.requireNonNull(scope, "scope")) {
            case SITE:
                return Optional.of(site());
            case USER:
                return Optional.of(user());
            case PROJECT:
                return currentProject().map(p -> p);
            default:
                throw new IllegalArgumentException("Unknown scope: " + scope);
        }
    }

    private LayerConfig requireLayer(ConfigScope scope) {
        return layer(scope).orElseThrow(() -> new IllegalStateException(
                "No current project; select a project before using the PROJECT layer"));
    }

    private Path fileFor(LayerConfig layer) {
        switch (layer.getScope()) {
            case SITE:
                if (locations.getSiteConfigFile() == null) {
                    throw new IllegalStateException("No site config file; set " + ConfigLocations.ENV_SITE_CONFIG);
                }
                return locations.getSiteConfigFile();
            case USER:
                return locations.getUserConfigFile();
            case PROJECT:
                return ConfigLocations.projectConfigFile(((ProjectConfig) layer).getRootPath());
            default:
                throw new IllegalArgumentException("Unknown scope: " + layer.getScope());
        }
    }

    private ProjectConfig register(ProjectConfig project) {
        ProjectConfig cached = loadedProjects.get(project.getScopeKey());
        if (cached != null) return cached;
        if (Files.isRegularFile(ConfigLocations.projectConfigFile(project.getRootPath()))) {
            return projectAt(project.getName(), project.getRootPath());
        }
        ProjectConfig existing = loadedProjects.putIfAbsent(project.getScopeKey(), project);
        return existing != null ? existing : project;
    }

    /**
     * Project layer at {@code root}, loaded on first use. When the file names the project
     * differently, the user's entry (and current project) is renamed to match the file.
     */
    private ProjectConfig projectAt(String name, Path root) {
        ScopeKey key = ScopeKey.of(ConfigScope.PROJECT, root);
        ProjectConfig cached = loadedProjects.get(key);
        if (cached != null) return cached;
        ProjectConfig loaded;
        ReentrantLock lock = writeLocks.get(ConfigScope.PROJECT);
        lock.lock();
        try {
            cached = loadedProjects.get(key);
            if (cached != null) return cached;
            loaded = loadProject(name, root);
            loadedProjects.put(key, loaded);
        } finally {
            lock.unlock();
        }
        String fileName = loaded.getName();
        if (!fileName.equals(name)) {
            UserConfig u = user();
            if (u.getProjects().containsKey(name)) {
                log.info("Project at {} is named {} in its config file; renaming user entry {}", root, fileName, name);
                withWriteLock(ConfigScope.USER, () -> u.renameProject(name, fileName));
                invalidate();
            }
        }
        return loaded;
    }

    private ScopeKey siteKey() {
        Path file = locations.getSiteConfigFile();
        return file != null ? ScopeKey.of(ConfigScope.SITE, file) : ScopeKey.unbound(ConfigScope.SITE);
    }

    private ScopeKey userKey() {
        return ScopeKey.of(ConfigScope.USER, locations.getUserDir());
    }

    private SiteConfig loadSite() {
        ScopeKey key = siteKey();
        return loadLayer(locations.getSiteConfigFile(), SiteConfig.class, key, () -> SiteConfig.defaults(key));
    }

    private UserConfig loadUser() {
        ScopeKey key = userKey();
        return loadLayer(locations.getUserConfigFile(), UserConfig.class, key, () -> UserConfig.defaults(key));
    }

    private ProjectConfig loadProject(String name, Path root) {
        ScopeKey key = ScopeKey.of(ConfigScope.PROJECT, root);
        return loadLayer(ConfigLocations.projectConfigFile(root), ProjectConfig.class, key,
                () -> ProjectConfig.create(name, root));
    }

    private <T extends LayerConfig> T loadLayer(Path file, Class<T> type, ScopeKey key, Supplier<T> defaults) {
        try {
            Optional<T> loaded = store.load(file, type, key);
            loadErrors.remove(key);
            startedFromDefaults.remove(key);
            if (loaded.isEmpty()) {
                log.debug("No configuration file for {}; using defaults", key);
            }
            return loaded.orElseGet(defaults);
        } catch (ConfigParseException e) {
            loadErrors.put(key, e);
            log.error("Configuration for {} is malformed ({}); keeping the last loaded state", key, e.getDiagnostic());
            throw e;
        }
    }

    private void startFromDefaults(ScopeKey key) {
        startedFromDefaults.add(key);
        log.warn("Starting {} from defaults; fix the file and reload to use it", key);
    }

    private void withWriteLock(ConfigScope scope, Runnable action) {
        ReentrantLock lock = writeLocks.get(scope);
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private void invalidate() {
        generation.incrementAndGet();
    }

    private static final class Snapshot {
        private final long generation;
        private final EffectiveConfig view;

        private Snapshot(long generation, EffectiveConfig view) {
            this.generation = generation;
            this.view = view;
        }
    }
}
