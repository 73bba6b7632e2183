/**
 * Built-in plugins (Shell, LocalFiles, LocalTasks, LogNotify) and the discovery entry point.
 * Registration happens through {@link com.deda.plugin.PluginDiscovery#registerBuiltIn}.
 */
package com.deda.internal.plugins;
