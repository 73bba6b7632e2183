package com.deda.plugin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginDiscoveryTest {

    @TempDir
    Path tempDir;

    @Test
    void discover_registersBuiltInsBeforeExternalJars() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("plugins"));
        writeServiceJar(dir.resolve("service.jar"), JarVisibleProvider.class.getName());
        PluginRegistry registry = new PluginRegistry();
        PluginDiscovery discovery = new PluginDiscovery(List.of(TestProviders.service("Builtin", "1.0")));

        DiscoveryReport report = discovery.discover(registry, List.of(dir));

        assertEquals(List.of("Builtin", "JarService"),
                registry.all().stream().map(PluginDescriptor::getName).collect(Collectors.toList()));
        assertTrue(registry.get("Builtin").orElseThrow().getOrigin().isBuiltIn());
        assertEquals(dir.resolve("service.jar").toAbsolutePath().normalize(),
                registry.get("JarService").orElseThrow().getOrigin().getPath().orElseThrow());
        assertEquals(2, report.getRegistered().size());
        assertFalse(report.hasFailures());
        assertTrue(registry.all().stream().allMatch(d -> d.getState() == LoadState.UNLOADED));
        discovery.close();
    }

    @Test
    void discover_brokenJarIsRecordedAndDoesNotStopLaterJars() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("plugins"));
        writeServiceJar(dir.resolve("a-broken.jar"), "com.vendor.DoesNotExist");
        writeServiceJar(dir.resolve("b-good.jar"), JarVisibleProvider.class.getName());
        PluginRegistry registry = new PluginRegistry();

        try (PluginDiscovery discovery = new PluginDiscovery()) {
            DiscoveryReport report = discovery.discover(registry, List.of(dir));

            assertTrue(report.hasFailures());
            assertTrue(report.getFailures().containsKey(dir.resolve("a-broken.jar").toString()));
            assertTrue(registry.get("JarService").isPresent());
        }
    }

    @Test
    void discover_skipsDisabledProviders() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("plugins"));
        writeServiceJar(dir.resolve("disabled.jar"), JarVisibleProvider.Disabled.class.getName());
        PluginRegistry registry = new PluginRegistry();

        try (PluginDiscovery discovery = new PluginDiscovery()) {
            DiscoveryReport report = discovery.discover(registry, List.of(dir));

            assertEquals(List.of("DisabledService"), report.getSkipped());
            assertEquals(0, registry.size());
        }
    }

    @Test
    void discover_missingDirectoryIsIgnoredAndFileIsAFailure() throws Exception {
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        PluginRegistry registry = new PluginRegistry();

        try (PluginDiscovery discovery = new PluginDiscovery()) {
            DiscoveryReport report = discovery.discover(registry, List.of(tempDir.resolve("missing"), file));

            assertEquals(1, report.getFailures().size());
            assertTrue(report.getFailures().containsKey(file.toString()));
            assertEquals(0, registry.size());
        }
    }

    @Test
    void restrictedLoader_deniesHostInternals() {
        assertTrue(RestrictedPluginClassLoader.isAllowed("com.deda.plugin.PluginProvider"));
        assertTrue(RestrictedPluginClassLoader.isAllowed("org.slf4j.Logger"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.deda.lifecycle.LifecycleManager"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.deda.plugins.localfiles.LocalFileManager"));
    }

    @Test
    void restrictedLoader_resolvesApiClassesAndHidesTheRest() throws Exception {
        RestrictedPluginClassLoader loader = new RestrictedPluginClassLoader();

        assertSame(PluginProvider.class, loader.loadClass(PluginProvider.class.getName()));
        assertThrows(ClassNotFoundException.class, () -> loader.loadClass("com.deda.bootstrap.DedaBootstrap"));
        assertThrows(ClassNotFoundException.class, () -> Class.forName("com.deda.lifecycle.LifecycleManager", false, loader));
    }

    private static void writeServiceJar(Path jar, String providerClass) throws IOException {
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream jarOut = new JarOutputStream(out)) {
            jarOut.putNextEntry(new JarEntry("META-INF/services/" + PluginProvider.class.getName()));
            jarOut.write((providerClass + "\n").getBytes(StandardCharsets.UTF_8));
            jarOut.closeEntry();
        }
    }
}
