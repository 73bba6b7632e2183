package com.deda.plugins.lognotify;

import com.deda.plugin.PluginContext;
import com.deda.plugin.PluginId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LogNotificationPluginTest {

    @Test
    void notify_keepsMostRecentFirst() {
        LogNotificationPlugin plugin = new LogNotificationPlugin();
        plugin.load(PluginContext.standalone(PluginId.of("LogNotify", "0.1.0")));

        plugin.notify("Asset approved", "char:hero:: is production ready");
        plugin.notify("Asset rejected", "prop:cup:: was rejected");

        assertEquals(List.of("Asset rejected: prop:cup:: was rejected",
                "Asset approved: char:hero:: is production ready"), plugin.getRecent());
    }

    @Test
    void notify_dropsOldestBeyondLimit() {
        LogNotificationPlugin plugin = new LogNotificationPlugin();
        for (int i = 0; i < LogNotificationPlugin.MAX_RECENT + 5; i++) {
            plugin.notify("n", String.valueOf(i));
        }

        List<String> recent = plugin.getRecent();
        assertEquals(LogNotificationPlugin.MAX_RECENT, recent.size());
        assertEquals("n: " + (LogNotificationPlugin.MAX_RECENT + 4), recent.get(0));
    }
}
