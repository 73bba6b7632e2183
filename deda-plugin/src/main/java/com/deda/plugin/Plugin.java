package com.deda.plugin;

/**
 * Base contract for all plugins. Capability contracts ({@link ApplicationPlugin},
 * {@link FileManagerPlugin}, ...) extend this so the registry can load and unload any plugin
 * without depending on concrete types.
 * <p>
 * Plugins that hold resources also implement {@link com.deda.annotations.ResourceCleanup}; the
 * registry calls {@code onExit()} on unload and shutdown.
 */
public interface Plugin {

    /**
     * Called once by the registry after the instance is created and its contracts are verified.
     * Connect to the backend here. Throwing marks the plugin FAILED with the exception message as
     * the reason; the plugin is then never handed out.
     *
     * @param context plugin id, effective configuration and current project root
     * @throws Exception when the backend is unreachable or misconfigured
     */
    default void load(PluginContext context) throws Exception {
    }
}
