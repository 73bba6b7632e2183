package com.deda.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginRefTest {

    @Test
    void accepts_anyVersionWhenUnconstrained() {
        assertTrue(PluginRef.of("Shell").accepts("0.1.0"));
        assertTrue(PluginRef.pinned("Shell", "*").accepts("9.9"));
    }

    @Test
    void accepts_prefixWildcardAndExactMatch() {
        PluginRef wildcard = PluginRef.pinned("LocalFiles", "1.*");
        assertTrue(wildcard.accepts("1.0.0"));
        assertTrue(wildcard.accepts("1.4"));
        assertFalse(wildcard.accepts("2.0.0"));
        assertFalse(wildcard.accepts("10.0"));

        PluginRef exact = PluginRef.pinned("LocalFiles", "1.2.0");
        assertTrue(exact.accepts("1.2.0"));
        assertFalse(exact.accepts("1.2.1"));
        assertFalse(exact.accepts(null));
    }

    @Test
    void constructor_rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new PluginRef("  ", null, null));
    }

    @Test
    void merge_higherLayerReferenceReplacesLowerByName() {
        ScopeKey siteKey = ScopeKey.unbound(ConfigScope.SITE);
        SiteConfig site = SiteConfig.defaults(siteKey);
        site.putPlugin(PluginRef.of("Shell"));
        site.putPlugin(PluginRef.of("LogNotify"));
        UserConfig user = UserConfig.defaults(ScopeKey.of(ConfigScope.USER, Path.of("home")));
        user.putPlugin(PluginRef.disabled("LogNotify"));
        ProjectConfig project = ProjectConfig.create("fenwick", Path.of("fenwick"));
        project.putPlugin(PluginRef.pinned("Shell", "0.*"));

        EffectiveConfig effective = EffectiveConfig.merge(site, user, project);

        assertEquals(List.of(PluginRef.pinned("Shell", "0.*"), PluginRef.disabled("LogNotify")),
                effective.getPluginRefs());
        assertFalse(effective.findPluginRef("LogNotify").orElseThrow().isEnabled());
    }

    @Test
    void resolvedSetting_convertsScalarsAndLists() {
        ResolvedSetting list = ResolvedSetting.of("dirs", List.of("a", "b"), ConfigScope.USER);
        ResolvedSetting scalar = ResolvedSetting.of("dirs", "a", ConfigScope.USER);
        ResolvedSetting flag = ResolvedSetting.of("flag", "true", ConfigScope.SITE);

        assertEquals(List.of("a", "b"), list.asStringList());
        assertEquals(List.of("a"), scalar.asStringList());
        assertTrue(flag.asBoolean(false));
        assertEquals(7, ResolvedSetting.notConfigured("n").asInt(7));
        assertTrue(ResolvedSetting.notConfigured("n").asStringList().isEmpty());
    }
}
