package com.deda.annotations;

/**
 * Contract for releasing resources when a plugin is unloaded or the host shuts down.
 * Plugins that hold backend connections, child processes or open file handles implement this
 * and release them in {@link #onExit()}. The plugin registry invokes {@code onExit()} on every
 * loaded plugin during shutdown, in reverse registration order.
 */
public interface ResourceCleanup {

    /**
     * Called once when the plugin is unloaded. Implementations release what they hold
     * (disconnect, stop watchers, flush stores). Exceptions are logged by the caller and
     * do not stop other plugins from being cleaned up.
     */
    void onExit();
}
