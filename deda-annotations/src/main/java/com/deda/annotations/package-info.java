/**
 * Shared contracts used across Dedaverse modules without pulling in the plugin API.
 * <ul>
 *   <li>{@link com.deda.annotations.ResourceCleanup} – onExit() on unload and shutdown</li>
 * </ul>
 */
package com.deda.annotations;
