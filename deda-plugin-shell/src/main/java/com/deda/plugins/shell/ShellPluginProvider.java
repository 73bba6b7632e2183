package com.deda.plugins.shell;

import com.deda.plugin.Capability;
import com.deda.plugin.Plugin;
import com.deda.plugin.PluginProvider;

import java.util.EnumSet;
import java.util.Set;

/**
 * Provider for the built-in Shell application plugin.
 */
public final class ShellPluginProvider implements PluginProvider {

    @Override
    public String getName() {
        return "Shell";
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
        return "Launch a terminal/shell with the Dedaverse environment";
    }

    @Override
    public Set<Capability> getCapabilities() {
        return EnumSet.of(Capability.APPLICATION);
    }

    @Override
    public Plugin createPlugin() {
        return new ShellApplicationPlugin();
    }
}
