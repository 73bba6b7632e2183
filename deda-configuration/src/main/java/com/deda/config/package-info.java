/**
 * Layered configuration for studio, operator and project.
 * <ul>
 *   <li>{@link com.deda.config.LayeredConfig} – resolver: Project over User over Site for reads, explicit scope for writes</li>
 *   <li>{@link com.deda.config.SiteConfig}, {@link com.deda.config.UserConfig}, {@link com.deda.config.ProjectConfig} – the three layers, identified by {@link com.deda.config.ScopeKey}</li>
 *   <li>{@link com.deda.config.EffectiveConfig} – immutable merged view; lookups return {@link com.deda.config.ResolvedSetting}</li>
 *   <li>{@link com.deda.config.PluginRef} – plugin activation with an optional version constraint</li>
 *   <li>{@link com.deda.config.ConfigLocations} – file locations from {@code DEDAVERSE_*} environment variables</li>
 *   <li>{@link com.deda.config.ConfigCodec} – JSON layout of layer files (sorted keys, 4-space indent)</li>
 * </ul>
 */
package com.deda.config;
