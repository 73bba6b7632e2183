package com.deda.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Finds plugins and registers them: built-in providers (shipped with the host) first, then
 * external jars from each search path.
 * <p>
 * Each search path is scanned non-recursively for {@code *.jar}, in file-name order. Each jar gets
 * its own class loader whose parent is a {@link RestrictedPluginClassLoader}, so external plugins
 * see only the plugin API, the configuration API and slf4j. Providers are found through
 * {@link ServiceLoader} (META-INF/services/com.deda.plugin.PluginProvider).
 * <p>
 * <b>Operational:</b> a jar that cannot be opened, or a provider that fails to instantiate, is
 * <b>logged, recorded in the {@link DiscoveryReport} and skipped</b>; discovery continues.
 */
public final class PluginDiscovery implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginDiscovery.class);

    private final List<PluginProvider> builtInProviders = new ArrayList<>();
    // keep references so classloaders are not GC'd while their plugins are registered
    private final List<URLClassLoader> externalLoaders = new ArrayList<>();

    public PluginDiscovery() {
    }

    public PluginDiscovery(List<PluginProvider> builtIns) {
        builtIns.forEach(this::registerBuiltIn);
    }

    /**
     * Adds a built-in provider (must be on the host classpath).
     */
    public void registerBuiltIn(PluginProvider provider) {
        if (provider != null) {
            builtInProviders.add(provider);
        }
    }

    public List<PluginProvider> getBuiltInProviders() {
        return new ArrayList<>(builtInProviders);
    }

    /**
     * Registers built-ins, then every provider found in {@code searchPaths}, into {@code registry}.
     * Sequential; nothing is loaded.
     *
     * @param searchPaths directories to scan; missing directories are skipped
     */
    public DiscoveryReport discover(PluginRegistry registry, List<Path> searchPaths) {
        DiscoveryReport report = new DiscoveryReport();
        for (PluginProvider provider : builtInProviders) {
            registerProvider(registry, provider, PluginOrigin.builtIn(), provider.getClass().getName(), report);
        }
        if (searchPaths != null) {
            for (Path dir : searchPaths) {
                scanDirectory(registry, dir, report);
            }
        }
        log.info("Plugin discovery finished: {} registered, {} skipped, {} failure(s)",
                report.getRegistered().size(), report.getSkipped().size(), report.getFailures().size());
        return report;
    }

    private void scanDirectory(PluginRegistry registry, Path dir, DiscoveryReport report) {
        if (dir == null) {
            return;
        }
        if (!Files.exists(dir)) {
            log.debug("Plugin directory does not exist: {}", dir);
            return;
        }
        if (!Files.isDirectory(dir)) {
            log.warn("Plugin path is not a directory: {}", dir);
            report.failed(dir, "Not a directory");
            return;
        }
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.jar")) {
            for (Path jar : stream) {
                if (Files.isRegularFile(jar)) jars.add(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list plugin directory {}: {}", dir, e.getMessage());
            report.failed(dir, "Cannot list directory: " + e.getMessage());
            return;
        }
        jars.sort(Comparator.comparing(p -> p.getFileName().toString()));
        for (Path jar : jars) {
            loadJar(registry, jar, report);
        }
    }

    /**
     * Registers the providers of one jar. On any failure (class loader, ServiceLoader, provider
     * constructor) logs at error level and records it; does not throw.
     */
    private void loadJar(PluginRegistry registry, Path jar, DiscoveryReport report) {
        try {
            URL jarUrl = jar.toUri().toURL();
            URLClassLoader loader = new URLClassLoader(new URL[]{jarUrl}, new RestrictedPluginClassLoader());
            externalLoaders.add(loader);

            Iterator<PluginProvider> providers = ServiceLoader.load(PluginProvider.class, loader).iterator();
            int n = 0;
            while (true) {
                PluginProvider provider;
                try {
                    if (!providers.hasNext()) break;
                    provider = providers.next();
                } catch (ServiceConfigurationError e) {
                    log.error("Plugin provider in JAR {} failed to instantiate (skipping this provider): {}",
                            jar.getFileName(), e.getMessage(), e);
                    report.failed(jar, e.getMessage());
                    continue;
                }
                if (registerProvider(registry, provider, PluginOrigin.external(jar), jar.toString(), report)) {
                    n++;
                }
            }
            if (n > 0) {
                log.info("Registered {} plugin(s) from JAR: {}", n, jar.getFileName());
            } else {
                log.debug("No plugin providers in JAR: {}", jar.getFileName());
            }
        } catch (Exception | LinkageError e) {
            log.error("Failed to load plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
            report.failed(jar, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }

    private static boolean registerProvider(PluginRegistry registry, PluginProvider provider, PluginOrigin origin,
                                            String source, DiscoveryReport report) {
        try {
            if (!provider.isEnabled()) {
                log.info("Plugin provider {} is disabled; not registered", provider.getName());
                report.skipped(provider.getName());
                return false;
            }
            report.registered(registry.register(provider, origin));
            return true;
        } catch (RuntimeException | LinkageError e) {
            log.error("Plugin provider from {} could not be registered: {}", source, e.getMessage(), e);
            report.failed(source, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            return false;
        }
    }

    /** Closes the class loaders of external jars. Call after the registry has shut down. */
    @Override
    public void close() {
        for (URLClassLoader loader : externalLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close plugin class loader: {}", e.getMessage());
            }
        }
        externalLoaders.clear();
    }
}
