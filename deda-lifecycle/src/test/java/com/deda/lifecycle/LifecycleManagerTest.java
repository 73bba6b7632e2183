package com.deda.lifecycle;

import com.deda.config.ConfigLocations;
import com.deda.config.ConfigScope;
import com.deda.config.LayeredConfig;
import com.deda.config.PluginRef;
import com.deda.config.ProjectConfig;
import com.deda.plugin.Capability;
import com.deda.plugin.PluginOrigin;
import com.deda.plugin.PluginProvider;
import com.deda.plugin.PluginRegistry;
import com.deda.plugin.PluginSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LifecycleManagerTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final AssetId HERO = AssetId.parse("char:hero::");

    @TempDir
    Path tempDir;

    private Path projectRoot;
    private LayeredConfig config;
    private final List<String> calls = new ArrayList<>();
    private FakePlugins.Files files;
    private FakePlugins.Tasks tasks;
    private FakePlugins.Notifier notifier;
    private PluginSelector selector;
    private LifecycleManager manager;

    @BeforeEach
    void setUp() throws Exception {
        projectRoot = Files.createDirectories(tempDir.resolve("fenwick"));
        config = newConfig();
        config.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));

        files = new FakePlugins.Files(calls);
        tasks = new FakePlugins.Tasks(calls);
        notifier = new FakePlugins.Notifier(calls);
        PluginRegistry registry = new PluginRegistry(config);
        for (PluginProvider p : List.of(
                FakePlugins.provider("FakeFiles", Capability.FILE_MANAGER, files),
                FakePlugins.provider("FakeTasks", Capability.TASK_MANAGER, tasks),
                FakePlugins.provider("FakeNotify", Capability.NOTIFICATION_SYSTEM, notifier))) {
            assertTrue(registry.load(registry.register(p, PluginOrigin.builtIn())));
        }
        selector = new PluginSelector(registry, config);
        manager = new LifecycleManager(config, selector, FIXED_CLOCK, "ana");
        manager.createAsset(HERO, "Hero", "character");
    }

    private LayeredConfig newConfig() {
        return new LayeredConfig(ConfigLocations.builder()
                .userDir(tempDir.resolve("home").resolve(".dedaverse"))
                .build(), FIXED_CLOCK);
    }

    @Test
    void transition_inDevelopmentToProductionReadyIsRefusedStructurally() {
        manager.transition(HERO, GateState.CANDIDATE);
        manager.transition(HERO, GateState.IN_DEVELOPMENT);
        int historySize = manager.get(HERO).orElseThrow().getHistory().size();
        calls.clear();

        IllegalTransitionException e = assertThrows(IllegalTransitionException.class,
                () -> manager.transition(HERO, GateState.PRODUCTION_READY));

        assertEquals(GateState.IN_DEVELOPMENT, e.getFrom());
        assertEquals(GateState.PRODUCTION_READY, e.getTo());
        AssetRecord record = manager.get(HERO).orElseThrow();
        assertEquals(GateState.IN_DEVELOPMENT, record.getState());
        assertEquals(historySize, record.getHistory().size());
        assertTrue(calls.isEmpty());
    }

    @Test
    void transition_ideaToCandidateToRejectedIsTerminal() {
        manager.transition(HERO, GateState.CANDIDATE);
        assertTrue(calls.isEmpty());

        AssetRecord record = manager.transition(HERO, GateState.REJECTED);

        assertEquals(GateState.REJECTED, record.getState());
        assertEquals(List.of("notify:Asset REJECTED"), calls);
        assertTrue(manager.availableTransitions(HERO).isEmpty());
        for (GateState target : GateState.values()) {
            assertThrows(IllegalTransitionException.class, () -> manager.transition(HERO, target));
        }
        assertEquals(2, record.getHistory().size());
        assertEquals(HERO, manager.assetsIn(GateState.REJECTED).get(0).getId());
    }

    @Test
    void transition_delegationFailureAppendsOneFailedEntryAndKeepsState() {
        manager.transition(HERO, GateState.CANDIDATE);
        tasks.failOn = "create";

        DelegationFailureException e = assertThrows(DelegationFailureException.class,
                () -> manager.transition(HERO, GateState.IN_DEVELOPMENT));

        assertEquals("tracker rejected task: quota exceeded", e.getReason());
        assertEquals("FakeTasks@1.0", e.getPlugin());
        assertTrue(e.getCause() instanceof java.io.IOException);
        AssetRecord record = manager.get(HERO).orElseThrow();
        assertEquals(GateState.CANDIDATE, record.getState());
        assertEquals(2, record.getHistory().size());
        TransitionEntry last = record.getLastEntry();
        assertEquals(TransitionOutcome.FAILED, last.getOutcome());
        assertEquals(GateState.IN_DEVELOPMENT, last.getTo());
        assertEquals("tracker rejected task: quota exceeded", last.getReason());
        assertEquals(List.of("FakeFiles@1.0", "FakeTasks@1.0"), last.getPlugins());
        assertEquals(List.of("checkout:hero.usda", "create:char:hero::", "revert:hero.usda"), calls);
        assertNull(record.getVersionedFile());
        assertTrue(record.getLinkedTasks().isEmpty());
    }

    @Test
    void transition_compensationFailureIsAttachedToTheDelegationFailure() {
        manager.transition(HERO, GateState.CANDIDATE);
        tasks.failOn = "link";
        files.failRevert = true;

        DelegationFailureException e = assertThrows(DelegationFailureException.class,
                () -> manager.transition(HERO, GateState.IN_DEVELOPMENT));

        assertEquals("link refused", e.getReason());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("revert refused", e.getSuppressed()[0].getMessage());
        assertEquals(TransitionOutcome.FAILED, manager.get(HERO).orElseThrow().getLastEntry().getOutcome());
    }

    @Test
    void transition_missingRequiredPluginIsADelegationFailure() {
        config.setPluginRef(ConfigScope.PROJECT, PluginRef.disabled("FakeFiles"));
        manager.transition(HERO, GateState.CANDIDATE);

        DelegationFailureException e = assertThrows(DelegationFailureException.class,
                () -> manager.transition(HERO, GateState.IN_DEVELOPMENT));

        assertNull(e.getPlugin());
        assertEquals("No active FILE_MANAGER plugin", e.getReason());
        assertTrue(calls.isEmpty());
        AssetRecord record = manager.get(HERO).orElseThrow();
        assertEquals(GateState.CANDIDATE, record.getState());
        assertEquals(TransitionOutcome.FAILED, record.getLastEntry().getOutcome());
        assertTrue(record.getLastEntry().getPlugins().isEmpty());
    }

    @Test
    void transition_unusableVersionedFilePathIsADelegationFailure() {
        config.set(ConfigScope.PROJECT, LifecycleManager.ASSETS_DIR_KEY, "assets\0broken");
        manager.transition(HERO, GateState.CANDIDATE);

        DelegationFailureException e = assertThrows(DelegationFailureException.class,
                () -> manager.transition(HERO, GateState.IN_DEVELOPMENT));

        assertNull(e.getPlugin());
        assertTrue(e.getCause() instanceof java.nio.file.InvalidPathException);
        assertTrue(calls.isEmpty());
        AssetRecord record = manager.get(HERO).orElseThrow();
        assertEquals(GateState.CANDIDATE, record.getState());
        assertEquals(2, record.getHistory().size());
        assertEquals(TransitionOutcome.FAILED, record.getLastEntry().getOutcome());
        assertEquals(e.getReason(), record.getLastEntry().getReason());
        assertNull(record.getVersionedFile());
    }

    @Test
    void transition_gatingViolationInvokesNoPluginAndWritesNoHistory() {
        manager.transition(HERO, GateState.CANDIDATE);
        manager.transition(HERO, GateState.IN_DEVELOPMENT);
        config.set(ConfigScope.PROJECT, GatingRules.KEY_PREFIX + "REVIEW", List.of("linked-task-status:done"));
        int historySize = manager.get(HERO).orElseThrow().getHistory().size();
        calls.clear();

        GatingViolationException e = assertThrows(GatingViolationException.class,
                () -> manager.transition(HERO, GateState.REVIEW));

        assertEquals(List.of("linked-task-status:done (T-1 is 'open')"), e.getUnmetRules());
        assertTrue(calls.isEmpty());
        assertEquals(historySize, manager.get(HERO).orElseThrow().getHistory().size());

        tasks.statuses.put("T-1", "Done");
        manager.transition(HERO, GateState.REVIEW);
        assertEquals(List.of("submit:hero.usda"), calls);
    }

    @Test
    void transition_fullChainRecordsFileTaskAndHistory() {
        manager.transition(HERO, GateState.CANDIDATE);
        manager.transition(HERO, GateState.IN_DEVELOPMENT);
        manager.transition(HERO, GateState.REVIEW);
        AssetRecord record = manager.transition(HERO, GateState.PRODUCTION_READY, "lead");

        assertEquals(GateState.PRODUCTION_READY, record.getState());
        assertTrue(Path.of(record.getVersionedFile()).endsWith(Path.of("assets", "char", "hero", "hero.usda")));
        assertEquals(List.of("T-1"), record.getLinkedTasks());
        assertEquals(List.of("checkout:hero.usda", "create:char:hero::", "link:char:hero::=T-1",
                "submit:hero.usda", "notify:Asset PRODUCTION_READY"), calls);
        List<TransitionEntry> history = record.getHistory();
        assertEquals(4, history.size());
        for (TransitionEntry entry : history) {
            assertEquals(TransitionOutcome.APPLIED, entry.getOutcome());
            assertEquals(FIXED_CLOCK.millis(), entry.getTimestampMillis());
        }
        assertEquals("ana", history.get(0).getActor());
        assertEquals("lead", history.get(3).getActor());
        assertEquals(List.of("FakeFiles@1.0", "FakeTasks@1.0"), history.get(1).getPlugins());
        assertEquals(List.of("FakeNotify@1.0"), history.get(3).getPlugins());
    }

    @Test
    void transition_notificationFailureIsNotedButStateAdvances() {
        notifier.fail = true;
        manager.transition(HERO, GateState.CANDIDATE);

        AssetRecord record = manager.transition(HERO, GateState.REJECTED);

        assertEquals(GateState.REJECTED, record.getState());
        assertEquals(TransitionOutcome.APPLIED, record.getLastEntry().getOutcome());
        assertEquals("Notification failed: mail relay down", record.getLastEntry().getReason());
    }

    @Test
    void unknownAndDuplicateAssetsAreRefused() {
        AssetId ghost = AssetId.parse("char:ghost::");

        UnknownAssetException e = assertThrows(UnknownAssetException.class,
                () -> manager.transition(ghost, GateState.CANDIDATE));
        assertEquals(ghost, e.getAssetId());
        assertThrows(IllegalArgumentException.class, () -> manager.createAsset(HERO, "Hero", "character"));
    }

    @Test
    void persist_thenNewManagerRestoresRecords() throws Exception {
        manager.createAsset(AssetId.parse("prop:lamp::"), "Lamp", "prop");
        manager.transition(HERO, GateState.CANDIDATE);
        manager.transition(HERO, GateState.IN_DEVELOPMENT);
        manager.persist();

        assertTrue(Files.isRegularFile(projectRoot.resolve(".dedaverse").resolve("project.cfg")));
        LayeredConfig fresh = newConfig();
        fresh.setCurrentProject(ProjectConfig.create("fenwick", projectRoot));
        LifecycleManager restored = new LifecycleManager(fresh, new PluginSelector(new PluginRegistry(fresh), fresh),
                FIXED_CLOCK, "ana");

        assertEquals(2, restored.assets().size());
        AssetRecord original = manager.get(HERO).orElseThrow();
        AssetRecord copy = restored.get(HERO).orElseThrow();
        assertEquals(GateState.IN_DEVELOPMENT, copy.getState());
        assertEquals(original.getHistory(), copy.getHistory());
        assertEquals(original.getLinkedTasks(), copy.getLinkedTasks());
        assertEquals(original.getVersionedFile(), copy.getVersionedFile());
        assertEquals("character", copy.getType());
    }

    @Test
    void persist_withoutProjectFails() {
        LayeredConfig noProject = newConfig();
        LifecycleManager detached = new LifecycleManager(noProject, selector, FIXED_CLOCK, "ana");
        detached.createAsset(HERO, "Hero", "character");

        assertThrows(IllegalStateException.class, detached::persist);
        assertSame(GateState.IDEA, detached.get(HERO).orElseThrow().getState());
    }

    @Test
    void restore_malformedRecordsFail() {
        config.set(ConfigScope.PROJECT, LifecycleManager.ASSETS_KEY, List.of(Map.of("id", "not-an-asset-id")));

        LifecycleException e = assertThrows(LifecycleException.class, () -> manager.restore());

        assertTrue(e.getMessage().contains("fenwick"));
        assertEquals(1, manager.assets().size());
    }
}
