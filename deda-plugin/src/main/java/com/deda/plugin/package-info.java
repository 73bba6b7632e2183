/**
 * Plugin contracts, provider SPI and registry. Plugins implement capability contracts and are
 * registered by {@link com.deda.plugin.PluginId} (name + version); the lifecycle manager asks the
 * {@link com.deda.plugin.PluginSelector} for the active plugin of a capability.
 * <ul>
 *   <li>{@link com.deda.plugin.Plugin} – base contract with the load hook</li>
 *   <li>{@link com.deda.plugin.Capability} – APPLICATION, FILE_MANAGER, TASK_MANAGER, SERVICE, TOOL, NOTIFICATION_SYSTEM, each bound to its contract</li>
 *   <li>{@link com.deda.plugin.PluginProvider} – SPI for built-in and external plugins (ServiceLoader)</li>
 *   <li>{@link com.deda.plugin.PluginRegistry} – registration, lookup, load/unload with recorded failures</li>
 *   <li>{@link com.deda.plugin.PluginDiscovery} – built-ins first, then jars from the plugin search paths</li>
 *   <li>{@link com.deda.plugin.RestrictedPluginClassLoader} – hardened parent for external JARs</li>
 *   <li>{@link com.deda.annotations.ResourceCleanup} – onExit() on unload and shutdown</li>
 * </ul>
 */
package com.deda.plugin;
