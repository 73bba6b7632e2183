package com.deda.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Result of a configuration lookup: either the value and the layer that supplied it, or
 * "not configured" when no layer holds the key. Absence is a normal result, not an error.
 */
public final class ResolvedSetting {

    private final String key;
    private final Object value;
    private final ConfigScope source;

    private ResolvedSetting(String key, Object value, ConfigScope source) {
        this.key = key;
        this.value = value;
        this.source = source;
    }

    public static ResolvedSetting of(String key, Object value, ConfigScope source) {
        return new ResolvedSetting(key, value, Objects.requireNonNull(source, "source"));
    }

    public static ResolvedSetting notConfigured(String key) {
        return new ResolvedSetting(key, null, null);
    }

    public String getKey() {
        return key;
    }

    public boolean isConfigured() {
        return source != null;
    }

    /** Raw value (JSON scalar, list or map); null when not configured or explicitly null. */
    public Object getValue() {
        return value;
    }

    /** Layer that supplied the value; null when not configured. */
    public ConfigScope getSource() {
        return source;
    }

    public Object orElse(Object defaultValue) {
        return isConfigured() && value != null ? value : defaultValue;
    }

    public String asString(String defaultValue) {
        Object v = orElse(null);
        return v != null ? String.valueOf(v) : defaultValue;
    }

    public boolean asBoolean(boolean defaultValue) {
        Object v = orElse(null);
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof String) {
            String s = ((String) v).trim();
            if (s.isEmpty()) return defaultValue;
            return "true".equalsIgnoreCase(s) || "1".equals(s);
        }
        return defaultValue;
    }

    public int asInt(int defaultValue) {
        Object v = orElse(null);
        if (v instanceof Number) return ((Number) v).intValue();
        if (v instanceof String) {
            try {
                return Integer.parseInt(((String) v).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Value as a list of strings: a JSON array is converted element-wise, a single scalar becomes a
     * one-element list, and a missing value becomes an empty list.
     */
    public List<String> asStringList() {
        Object v = orElse(null);
        List<String> out = new ArrayList<>();
        if (v instanceof Collection) {
            for (Object o : (Collection<?>) v) {
                if (o != null) out.add(String.valueOf(o));
            }
        } else if (v != null) {
            out.add(String.valueOf(v));
        }
        return out;
    }

    @Override
    public String toString() {
        return isConfigured() ? key + "=" + value + " (" + source + ")" : key + " (not configured)";
    }
}
