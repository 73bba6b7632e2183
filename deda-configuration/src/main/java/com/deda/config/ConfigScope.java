package com.deda.config;

/**
 * Configuration layers in ascending precedence. On read, a key set in {@link #PROJECT} overrides
 * the same key in {@link #USER}, which overrides {@link #SITE}.
 */
public enum ConfigScope {

    /** Studio-wide settings from the file named by {@code DEDAVERSE_SITE_CONFIG}. */
    SITE,

    /** Per-operator settings from {@code ~/.dedaverse/user.cfg}. */
    USER,

    /** Per-project settings from {@code <projectRoot>/.dedaverse/project.cfg}. */
    PROJECT;

    /** Whether this layer wins over {@code other} when both hold the same key. */
    public boolean overrides(ConfigScope other) {
        return other != null && ordinal() > other.ordinal();
    }
}
