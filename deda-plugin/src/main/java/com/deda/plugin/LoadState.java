package com.deda.plugin;

/**
 * Load state of a registered plugin. {@code UNLOADED|FAILED -> LOADING -> LOADED|FAILED};
 * unload returns a LOADED plugin to UNLOADED.
 */
public enum LoadState {
    UNLOADED,
    LOADING,
    LOADED,
    FAILED
}
