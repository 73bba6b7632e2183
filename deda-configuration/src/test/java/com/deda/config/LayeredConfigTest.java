package com.deda.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LayeredConfigTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path siteFile;
    private Path userDir;
    private Path projectRoot;
    private LayeredConfig config;

    @BeforeEach
    void setUp() throws Exception {
        siteFile = tempDir.resolve("site").resolve("site.cfg");
        userDir = tempDir.resolve("home").resolve(".dedaverse");
        projectRoot = Files.createDirectories(tempDir.resolve("projects").resolve("fenwick"));
        config = newConfig();
    }

    private LayeredConfig newConfig() {
        return new LayeredConfig(ConfigLocations.builder()
                .siteConfigFile(siteFile)
                .userDir(userDir)
                .build(), FIXED_CLOCK);
    }

    @Test
    void resolve_fallsThroughToSiteWhenProjectAndUserAreSilent() {
        config.set(ConfigScope.SITE, "render.engine", "arnold");
        config.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));

        ResolvedSetting setting = config.resolve("render.engine");

        assertTrue(setting.isConfigured());
        assertEquals("arnold", setting.getValue());
        assertEquals(ConfigScope.SITE, setting.getSource());
    }

    @Test
    void resolve_projectOverridesUserOverridesSite() {
        config.set(ConfigScope.SITE, "fps", 24);
        config.set(ConfigScope.USER, "fps", 25);
        assertEquals(25, config.resolve("fps").getValue());
        assertEquals(ConfigScope.USER, config.resolve("fps").getSource());

        config.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));
        config.set(ConfigScope.PROJECT, "fps", 30);

        assertEquals(30, config.resolve("fps").getValue());
        assertEquals(ConfigScope.PROJECT, config.resolve("fps").getSource());
        assertEquals(24, config.get(ConfigScope.SITE, "fps").getValue());
    }

    @Test
    void resolve_unknownKeyIsNotConfigured() {
        ResolvedSetting setting = config.resolve("does.not.exist");

        assertFalse(setting.isConfigured());
        assertNull(setting.getSource());
        assertEquals("fallback", setting.asString("fallback"));
    }

    @Test
    void remove_makesLowerLayerVisibleAgain() {
        config.set(ConfigScope.SITE, "fps", 24);
        config.set(ConfigScope.USER, "fps", 25);

        assertTrue(config.remove(ConfigScope.USER, "fps"));

        assertEquals(24, config.resolve("fps").getValue());
        assertFalse(config.remove(ConfigScope.USER, "fps"));
    }

    @Test
    void set_projectWithoutCurrentProjectFails() {
        assertThrows(IllegalStateException.class, () -> config.set(ConfigScope.PROJECT, "fps", 30));
        assertFalse(config.get(ConfigScope.PROJECT, "fps").isConfigured());
    }

    @Test
    void save_thenFreshInstanceReadsSameValues() throws Exception {
        config.set(ConfigScope.SITE, "studio", "Deda");
        config.set(ConfigScope.USER, "theme", "dark");
        config.set(ConfigScope.USER, "frames", 240L);
        config.set(ConfigScope.USER, "playback", 23.976f);
        config.set(ConfigScope.USER, "limits", Map.of("maxFrames", 9_000_000_000L));
        config.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));
        config.set(ConfigScope.PROJECT, "fps", 30);
        config.setPluginRef(ConfigScope.PROJECT, PluginRef.pinned("LocalFiles", "1.*"));
        config.save(ConfigScope.SITE);
        config.save(ConfigScope.USER);
        config.save(ConfigScope.PROJECT);

        assertTrue(Files.isRegularFile(siteFile));
        assertTrue(Files.isRegularFile(userDir.resolve("user.cfg")));
        assertTrue(Files.isRegularFile(projectRoot.resolve(".dedaverse").resolve("project.cfg")));

        LayeredConfig fresh = newConfig();
        assertEquals("Deda", fresh.resolve("studio").getValue());
        assertEquals("dark", fresh.resolve("theme").getValue());
        assertEquals(30, fresh.resolve("fps").getValue());
        for (LayeredConfig c : List.of(config, fresh)) {
            assertEquals(Integer.valueOf(240), c.resolve("frames").getValue());
            assertEquals(Double.valueOf(23.976), c.resolve("playback").getValue());
            assertEquals(Map.of("maxFrames", 9_000_000_000L), c.resolve("limits").getValue());
        }
        assertEquals("fenwick", fresh.currentProject().orElseThrow().getName());
        assertEquals(List.of(PluginRef.pinned("LocalFiles", "1.*")), fresh.activePluginRefs());
        assertEquals(FIXED_CLOCK.millis(), fresh.user().getSavedAtMillis());
    }

    @Test
    void save_writesSortedKeysWithFourSpaceIndent() throws Exception {
        config.set(ConfigScope.USER, "zeta", 1);
        config.set(ConfigScope.USER, "alpha", 2);
        config.save(ConfigScope.USER);

        String json = Files.readString(userDir.resolve("user.cfg"), StandardCharsets.UTF_8);
        assertTrue(json.indexOf("\"alpha\"") < json.indexOf("\"zeta\""));
        assertTrue(json.contains("\n    \"savedAtMillis\""));
    }

    @Test
    void save_siteWithoutConfiguredFileFails() {
        LayeredConfig noSite = new LayeredConfig(ConfigLocations.builder().userDir(userDir).build());
        noSite.set(ConfigScope.SITE, "studio", "Deda");

        assertFalse(noSite.site().getScopeKey().isBound());
        assertThrows(IllegalStateException.class, () -> noSite.save(ConfigScope.SITE));
        assertEquals("Deda", noSite.resolve("studio").getValue());
    }

    @Test
    void reload_picksUpExternalEditOfOneLayerOnly() throws Exception {
        config.set(ConfigScope.USER, "theme", "dark");
        config.save(ConfigScope.USER);
        config.set(ConfigScope.SITE, "studio", "unsaved");

        Files.writeString(userDir.resolve("user.cfg"), "{\"settings\": {\"theme\": \"light\"}}", StandardCharsets.UTF_8);
        config.reload(ConfigScope.USER);

        assertEquals("light", config.resolve("theme").getValue());
        assertEquals("unsaved", config.resolve("studio").getValue());
    }

    @Test
    void reload_malformedFileKeepsLastKnownGoodLayer() throws Exception {
        config.set(ConfigScope.USER, "theme", "dark");
        config.save(ConfigScope.USER);
        Files.writeString(userDir.resolve("user.cfg"), "{\"settings\": {\"theme\": ", StandardCharsets.UTF_8);

        ConfigParseException e = assertThrows(ConfigParseException.class, () -> config.reload(ConfigScope.USER));

        assertEquals(userDir.resolve("user.cfg"), e.getPath());
        assertTrue(e.getDiagnostic().contains("line"));
        assertEquals("dark", config.resolve("theme").getValue());
        assertTrue(config.getLoadErrors().containsKey(config.user().getScopeKey()));
    }

    @Test
    void lazyLoad_malformedFileFailsAndLeavesLayerUnloaded() throws Exception {
        Files.createDirectories(siteFile.getParent());
        Files.writeString(siteFile, "not json", StandardCharsets.UTF_8);

        assertThrows(ConfigParseException.class, () -> config.site());

        Files.writeString(siteFile, "{\"name\": \"Deda\"}", StandardCharsets.UTF_8);
        assertEquals("Deda", config.site().getName());
        assertTrue(config.getLoadErrors().isEmpty());
    }

    @Test
    void set_rejectsValuesThatCannotBeWrittenAsJson() {
        assertThrows(IllegalArgumentException.class, () -> config.set(ConfigScope.USER, "handle", new Object()));
        assertFalse(config.resolve("handle").isConfigured());
    }

    @Test
    void loadLayers_malformedUserFileStartsFromDefaultsAndSiteStillLoads() throws Exception {
        Files.createDirectories(siteFile.getParent());
        Files.writeString(siteFile, "{\"settings\": {\"studio\": \"Deda\"}}", StandardCharsets.UTF_8);
        Files.createDirectories(userDir);
        Files.writeString(userDir.resolve("user.cfg"), "{ not json", StandardCharsets.UTF_8);

        Map<ScopeKey, ConfigParseException> errors = config.loadLayers();

        assertEquals(Set.of(ScopeKey.of(ConfigScope.USER, userDir)), errors.keySet());
        assertEquals("Deda", config.resolve("studio").getValue());
        assertTrue(config.user().getProjects().isEmpty());
        assertTrue(config.currentProject().isEmpty());
        assertThrows(IllegalStateException.class, () -> config.save(ConfigScope.USER));
        assertEquals("{ not json", Files.readString(userDir.resolve("user.cfg"), StandardCharsets.UTF_8));
    }

    @Test
    void loadLayers_malformedProjectFileStartsFromDefaultsUntilReloaded() throws Exception {
        Path cfg = Files.createDirectories(projectRoot.resolve(".dedaverse")).resolve("project.cfg");
        Files.writeString(cfg, "{\"settings\": ", StandardCharsets.UTF_8);
        Files.createDirectories(userDir);
        Files.writeString(userDir.resolve("user.cfg"), "{\"currentProject\": \"fenwick\", \"projects\": {"
                + "\"fenwick\": " + jsonString(projectRoot) + "}}", StandardCharsets.UTF_8);

        Map<ScopeKey, ConfigParseException> errors = config.loadLayers();

        assertEquals(Set.of(ScopeKey.of(ConfigScope.PROJECT, projectRoot)), errors.keySet());
        assertEquals("fenwick", config.currentProject().orElseThrow().getName());
        assertFalse(config.get(ConfigScope.PROJECT, "fps").isConfigured());
        assertThrows(IllegalStateException.class, () -> config.save(ConfigScope.PROJECT));

        Files.writeString(cfg, "{\"settings\": {\"fps\": 30}}", StandardCharsets.UTF_8);
        config.reload(ConfigScope.PROJECT);

        assertEquals(30, config.resolve("fps").getValue());
        assertTrue(config.getLoadErrors().isEmpty());
        config.save(ConfigScope.PROJECT);
    }

    @Test
    void apps_mergeByNameAndVersionWithHigherLayersWinning() {
        config.setApp(ConfigScope.SITE, new AppConfig("Maya", "2025", "maya", null, null, null, true));
        config.setApp(ConfigScope.SITE, new AppConfig("Maya", "2024", "maya2024", null, null, null, true));
        config.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));
        config.setApp(ConfigScope.PROJECT, new AppConfig("Maya", "2025", "maya -proj fenwick", null, null, null, false));
        config.setApp(ConfigScope.USER, new AppConfig("Houdini", null, "houdini", null, null, null, null));

        List<AppConfig> apps = config.effective().getApps();

        assertEquals(3, apps.size());
        assertEquals("Maya", apps.get(0).getName());
        assertEquals("2024", apps.get(0).getVersion());
        AppConfig maya = config.effective().findApp("Maya", "2025").orElseThrow();
        assertEquals("maya -proj fenwick", maya.getCommand());
        assertFalse(maya.isEnabled());
        assertTrue(config.effective().findApp("Houdini", "").orElseThrow().isEnabled());

        assertTrue(config.removeApp(ConfigScope.PROJECT, "Maya", "2025"));
        assertEquals("maya", config.effective().findApp("Maya", "2025").orElseThrow().getCommand());
    }

    @Test
    void apps_andSiteServicesSurviveSave() throws Exception {
        Files.createDirectories(siteFile.getParent());
        Files.writeString(siteFile, "{\"name\": \"Deda\","
                + " \"pluginUrls\": [\"https://plugins.example.com/deda\"],"
                + " \"services\": [{\"name\": \"tracker\", \"url\": \"https://tracker.example.com\"}]}",
                StandardCharsets.UTF_8);
        config.setApp(ConfigScope.SITE, new AppConfig("Nuke", "15.1", "nuke", "icons/nuke.png",
                "https://install.example.com/nuke", "https://help.example.com/nuke", null));
        config.save(ConfigScope.SITE);

        LayeredConfig fresh = newConfig();

        assertEquals(List.of("https://plugins.example.com/deda"), fresh.site().getPluginUrls());
        ServiceConfig tracker = fresh.effective().findService("tracker").orElseThrow();
        assertEquals("https://tracker.example.com", tracker.getUrl());
        assertTrue(tracker.isEnabled());
        AppConfig nuke = fresh.effective().findApp("Nuke", "15.1").orElseThrow();
        assertEquals("icons/nuke.png", nuke.getIconPath());
        assertEquals("https://install.example.com/nuke", nuke.getInstallUrl());
        assertEquals("https://help.example.com/nuke", nuke.getHelpUrl());
    }

    @Test
    void setRoles_isVisibleImmediatelyAndPersists() throws Exception {
        EffectiveConfig before = config.effective();

        config.setRoles(List.of("animator", "rigger"));
        config.save(ConfigScope.USER);

        assertNotSame(before, config.effective());
        assertEquals(List.of("animator", "rigger"), config.user().getRoles());
        assertEquals(List.of("animator", "rigger"), newConfig().user().getRoles());
    }

    @Test
    void projectNamedDifferentlyInItsFile_renamesUserEntryAndCurrentProject() throws Exception {
        Path other = Files.createDirectories(tempDir.resolve("projects").resolve("other"));
        Files.createDirectories(projectRoot.resolve(".dedaverse"));
        Files.writeString(projectRoot.resolve(".dedaverse").resolve("project.cfg"), "{\"name\": \"Fenwick Hollow\"}",
                StandardCharsets.UTF_8);
        Files.createDirectories(userDir);
        Files.writeString(userDir.resolve("user.cfg"), "{\"currentProject\": \"fenwick\", \"projects\": {"
                + "\"fenwick\": " + jsonString(projectRoot) + ", "
                + "\"other\": " + jsonString(other) + "}}", StandardCharsets.UTF_8);

        ProjectConfig current = config.currentProject().orElseThrow();

        assertEquals("Fenwick Hollow", current.getName());
        assertEquals("Fenwick Hollow", config.user().getCurrentProject());
        assertEquals(List.of("Fenwick Hollow", "other"), List.copyOf(config.user().getProjects().keySet()));
        assertEquals(projectRoot.toString(), config.user().getProjects().get("Fenwick Hollow"));
        assertTrue(config.getProject("Fenwick Hollow").isPresent());
        assertTrue(config.getProject("fenwick").isEmpty());
    }

    @Test
    void project_isWritableUntilItsFileIsReadOnly() throws Exception {
        ProjectConfig project = config.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));
        assertTrue(project.isWritable());

        config.save(ConfigScope.PROJECT);
        Path cfg = projectRoot.resolve(".dedaverse").resolve("project.cfg");
        assertTrue(project.isWritable());

        assertTrue(cfg.toFile().setWritable(false));
        try {
            assertEquals(Files.isWritable(cfg), project.isWritable());
        } finally {
            cfg.toFile().setWritable(true);
        }
    }

    @Test
    void project_atFilesystemRootIsNamedAfterTheRoot() {
        Path fsRoot = tempDir.getRoot();

        ProjectConfig project = ProjectConfig.create(" ", fsRoot);

        assertEquals(fsRoot.toAbsolutePath().toString(), project.getName());
    }

    @Test
    void effective_isCachedUntilMutation() {
        EffectiveConfig first = config.effective();
        assertSame(first, config.effective());

        config.set(ConfigScope.USER, "theme", "dark");

        EffectiveConfig second = config.effective();
        assertNotSame(first, second);
        assertEquals("dark", second.getString("theme", null));
        assertFalse(first.isConfigured("theme"));
    }

    @Test
    void layers_areEqualByKeyNotBySettings() {
        ProjectConfig a = ProjectConfig.create("fenwick", projectRoot);
        ProjectConfig b = ProjectConfig.create("other-name", projectRoot.resolve("..").resolve("fenwick"));
        config.setCurrentProject(a);
        config.set(ConfigScope.PROJECT, "fps", 30);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        Set<ProjectConfig> set = new HashSet<>();
        set.add(a);
        set.add(b);
        assertEquals(1, set.size());
        assertTrue(set.contains(config.currentProject().orElseThrow()));
    }

    @Test
    void projects_listsKnownProjectsAndSkipsMalformedOnes() throws Exception {
        Path broken = Files.createDirectories(tempDir.resolve("projects").resolve("broken"));
        Files.createDirectories(broken.resolve(".dedaverse"));
        Files.writeString(broken.resolve(".dedaverse").resolve("project.cfg"), "{", StandardCharsets.UTF_8);

        Files.createDirectories(userDir);
        Files.writeString(userDir.resolve("user.cfg"), "{\"projects\": {"
                + "\"fenwick\": " + jsonString(projectRoot) + ", "
                + "\"broken\": " + jsonString(broken) + "}}", StandardCharsets.UTF_8);

        List<ProjectConfig> projects = config.projects();

        assertEquals(1, projects.size());
        assertEquals("fenwick", projects.get(0).getName());
        assertTrue(config.getProject("fenwick").isPresent());
        assertTrue(config.currentProject().isEmpty());
        assertEquals(1, config.getLoadErrors().size());
    }

    @Test
    void gatingRules_flowIntoEffectiveView() {
        config.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));
        config.setGatingRule("REVIEW", List.of("linked-task", "versioned-file"));

        Map<String, List<String>> rules = config.effective().getGatingRules();

        assertEquals(List.of("linked-task", "versioned-file"), rules.get("REVIEW"));
        assertEquals("fenwick", config.effective().getProjectName());
    }

    @Test
    void pluginDirs_combinesEnvironmentAndConfiguredPaths() {
        Path envDir = tempDir.resolve("env-plugins");
        Path cfgDir = tempDir.resolve("cfg-plugins");
        LayeredConfig withEnv = new LayeredConfig(ConfigLocations.builder()
                .userDir(userDir)
                .pluginDirs(List.of(envDir))
                .build());
        withEnv.set(ConfigScope.USER, LayeredConfig.PLUGIN_DIRS_KEY, List.of(cfgDir.toString(), envDir.toString()));

        assertEquals(List.of(envDir, cfgDir), withEnv.pluginDirs());
    }

    private static String jsonString(Path path) throws Exception {
        return ConfigCodec.mapper().writeValueAsString(path.toString());
    }
}
