package com.deda.plugins.localfiles;

import com.deda.plugin.Capability;
import com.deda.plugin.Plugin;
import com.deda.plugin.PluginProvider;

import java.util.EnumSet;
import java.util.Set;

/**
 * Provider for the built-in LocalFiles file manager. The depot location is read from configuration
 * when the plugin loads, not here.
 */
public final class LocalFilesPluginProvider implements PluginProvider {

    @Override
    public String getName() {
        return "LocalFiles";
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
        return "Versions files in a local or network depot directory";
    }

    @Override
    public Set<Capability> getCapabilities() {
        return EnumSet.of(Capability.FILE_MANAGER);
    }

    @Override
    public Plugin createPlugin() {
        return new LocalFileManagerPlugin();
    }
}
