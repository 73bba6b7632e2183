package com.deda.plugins.localtasks;

import com.deda.plugin.Capability;
import com.deda.plugin.Plugin;
import com.deda.plugin.PluginProvider;

import java.util.EnumSet;
import java.util.Set;

/**
 * Provider for the built-in LocalTasks task manager.
 */
public final class LocalTasksPluginProvider implements PluginProvider {

    @Override
    public String getName() {
        return "LocalTasks";
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
        return "Tracks tasks in a JSON file next to the project";
    }

    @Override
    public Set<Capability> getCapabilities() {
        return EnumSet.of(Capability.TASK_MANAGER);
    }

    @Override
    public Plugin createPlugin() {
        return new LocalTaskManagerPlugin();
    }
}
