package com.deda.plugins.lognotify;

import com.deda.plugin.Capability;
import com.deda.plugin.Plugin;
import com.deda.plugin.PluginProvider;

import java.util.EnumSet;
import java.util.Set;

/**
 * Provider for the built-in LogNotify notification system.
 */
public final class LogNotifyPluginProvider implements PluginProvider {

    @Override
    public String getName() {
        return "LogNotify";
    }

    @Override
    public String getVersion() {
        return "0.1.0";
    }

    @Override
    public String getVendor() {
        return "Deda";
    }

    @Override
    public String getDescription() {
        return "Writes lifecycle notifications to the application log";
    }

    @Override
    public Set<Capability> getCapabilities() {
        return EnumSet.of(Capability.NOTIFICATION_SYSTEM);
    }

    @Override
    public Plugin createPlugin() {
        return new LogNotificationPlugin();
    }
}
