package com.pipeline.adg.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Identifier of an asset: an ordered sequence of non-empty path segments.
 * Segments never contain {@value #SEPARATOR}, so the display form parses back
 * to an equal key.
 *
 * Equality, hashing and ordering are segment-wise. The display form joins the
 * segments with {@value #SEPARATOR}, e.g. {@code warehouse/orders/daily}.
 *
 * Instances are immutable.
 */
public final class AssetKey implements Comparable<AssetKey> {
    public static final String SEPARATOR = "/";

    private final List<String> path;

    private AssetKey(List<String> path) {
        this.path = path;
    }

    public static AssetKey of(String... path) {
        return of(Arrays.asList(path));
    }

    public static AssetKey of(List<String> path) {
        if (path == null || path.isEmpty())
            throw new IllegalArgumentException("Asset key needs at least one path segment");
        List<String> copy = new ArrayList<>(path.size());
        for (String segment : path) {
            if (segment == null || segment.isEmpty())
                throw new IllegalArgumentException("Asset key segments must be non-empty: " + path);
            if (segment.contains(SEPARATOR))
                throw new IllegalArgumentException(
                        "Asset key segment '" + segment + "' contains '" + SEPARATOR + "', use separate segments");
            copy.add(segment);
        }
        return new AssetKey(List.copyOf(copy));
    }

    /**
     * Parses the display form produced by {@link #toUserString()}.
     */
    @JsonCreator
    public static AssetKey parse(String userString) {
        if (userString == null || userString.isEmpty())
            throw new IllegalArgumentException("Cannot parse an empty asset key");
        return of(userString.split(SEPARATOR, -1));
    }

    public List<String> path() {
        return path;
    }

    public int size() {
        return path.size();
    }

    public String lastSegment() {
        return path.get(path.size() - 1);
    }

    public AssetKey withPrefix(String... prefix) {
        List<String> joined = new ArrayList<>(prefix.length + path.size());
        joined.addAll(Arrays.asList(prefix));
        joined.addAll(path);
        return of(joined);
    }

    @JsonValue
    public String toUserString() {
        return String.join(SEPARATOR, path);
    }

    @Override
    public int compareTo(AssetKey other) {
        int n = Math.min(path.size(), other.path.size());
        for (int i = 0; i < n; i++) {
            int c = path.get(i).compareTo(other.path.get(i));
            if (c != 0)
                return c;
        }
        return Integer.compare(path.size(), other.path.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof AssetKey other && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return toUserString();
    }
}
