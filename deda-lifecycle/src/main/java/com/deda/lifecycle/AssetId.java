package com.deda.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of an asset, unique per project. Format {@code prefix::suffix}:
 * <ul>
 *   <li>prefix: one or more USD prim names ({@code [A-Za-z_][A-Za-z0-9_]*}) joined by single {@code :},
 *       e.g. {@code fenwick:char:hero}</li>
 *   <li>suffix: optional element path, optionally ending in {@code #<version>} or
 *       {@code @<changelist>} (not both), e.g. {@code model/hero.usd#3}</li>
 * </ul>
 * Ordered, compared and hashed by its string value.
 */
public final class AssetId implements Comparable<AssetId> {

    static final String SEPARATOR = "::";
    private static final Pattern PRIM_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern VERSION_SUFFIX = Pattern.compile("([^#@]*)#(\\d+)");
    private static final Pattern CHANGELIST_SUFFIX = Pattern.compile("([^#@]*)@(\\d+)");

    private final String value;
    private final String prefix;
    private final String suffix;
    private final Integer version;
    private final Integer changelist;

    private AssetId(String value, String prefix, String suffix, Integer version, Integer changelist) {
        this.value = value;
        this.prefix = prefix;
        this.suffix = suffix;
        this.version = version;
        this.changelist = changelist;
    }

    /**
     * Parses and validates an asset id. Surrounding whitespace is ignored.
     *
     * @throws IllegalArgumentException if the id has no {@code ::}, a prefix segment is empty or not
     *                                  a valid prim name, or the suffix has both or malformed {@code #}/{@code @} parts
     */
    @JsonCreator
    public static AssetId parse(String assetId) {
        Objects.requireNonNull(assetId, "assetId");
        String trimmed = assetId.trim();
        int sep = trimmed.indexOf(SEPARATOR);
        if (sep < 0) {
            throw new IllegalArgumentException("Asset id must contain \"::\" separator, got '" + trimmed + "'");
        }
        String prefix = trimmed.substring(0, sep);
        String suffix = trimmed.substring(sep + SEPARATOR.length());
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("Asset id prefix (before \"::\") must be non-empty, got '" + trimmed + "'");
        }
        String[] segments = prefix.split(":", -1);
        for (int i = 0; i < segments.length; i++) {
            if (segments[i].isEmpty()) {
                throw new IllegalArgumentException("Asset id prefix segment " + i
                        + " is empty (double, leading or trailing ':'), got '" + trimmed + "'");
            }
            if (!PRIM_NAME.matcher(segments[i]).matches()) {
                throw new IllegalArgumentException("Asset id prefix segment '" + segments[i]
                        + "' is not a valid prim name ([A-Za-z_][A-Za-z0-9_]*)");
            }
        }
        Integer version = null;
        Integer changelist = null;
        boolean hasVersion = suffix.indexOf('#') >= 0;
        boolean hasChangelist = suffix.indexOf('@') >= 0;
        if (hasVersion && hasChangelist) {
            throw new IllegalArgumentException("Asset id suffix '" + suffix
                    + "' cannot have both #version and @changelist");
        }
        if (hasVersion || hasChangelist) {
            Matcher m = (hasVersion ? VERSION_SUFFIX : CHANGELIST_SUFFIX).matcher(suffix);
            if (!m.matches()) {
                throw new IllegalArgumentException("Asset id suffix '" + suffix
                        + "': # and @ must be followed by an integer only");
            }
            int number;
            try {
                number = Integer.parseInt(m.group(2));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Asset id suffix '" + suffix + "': number out of range", e);
            }
            if (hasVersion) version = number;
            else changelist = number;
        }
        return new AssetId(trimmed, prefix, suffix, version, changelist);
    }

    /** Part before {@code ::}. */
    public String getPrefix() {
        return prefix;
    }

    /** Part after {@code ::}; empty for a scope id. */
    public String getSuffix() {
        return suffix;
    }

    public List<String> getSegments() {
        return Arrays.asList(prefix.split(":"));
    }

    /** Last prefix segment, e.g. {@code hero} for {@code char:hero::}. */
    public String getName() {
        return prefix.substring(prefix.lastIndexOf(':') + 1);
    }

    /** This id with an empty suffix ({@code prefix::}). */
    public AssetId scope() {
        return suffix.isEmpty() ? this : new AssetId(prefix + SEPARATOR, prefix, "", null, null);
    }

    public boolean isScope() {
        return suffix.isEmpty();
    }

    /** Number of a {@code #int} suffix. */
    public OptionalInt version() {
        return version != null ? OptionalInt.of(version) : OptionalInt.empty();
    }

    /** Number of an {@code @int} suffix. */
    public OptionalInt changelist() {
        return changelist != null ? OptionalInt.of(changelist) : OptionalInt.empty();
    }

    @Override
    public int compareTo(AssetId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((AssetId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
