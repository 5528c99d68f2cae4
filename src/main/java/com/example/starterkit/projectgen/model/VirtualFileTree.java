package com.example.starterkit.projectgen.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory path -> content map for a generated project. Instances are
 * immutable; use {@link #toBuilder()} to derive a new tree with more files.
 * Paths are output-relative, use forward slashes and iterate in sorted order.
 */
public final class VirtualFileTree {
    private final Map<String, byte[]> files;
    private final int overwrites;

    private VirtualFileTree(Map<String, byte[]> files, int overwrites) {
        this.files = Collections.unmodifiableMap(new TreeMap<>(files));
        this.overwrites = overwrites;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static VirtualFileTree empty() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.files.putAll(files);
        builder.overwrites = overwrites;
        return builder;
    }

    public boolean contains(String path) {
        return files.containsKey(normalize(path));
    }

    public Optional<byte[]> read(String path) {
        byte[] content = files.get(normalize(path));
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    public Optional<String> readString(String path) {
        return read(path).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public List<String> paths() {
        return new ArrayList<>(files.keySet());
    }

    public int size() {
        return files.size();
    }

    /**
     * Number of times a later write replaced an earlier file at the same path
     */
    public int getOverwrites() {
        return overwrites;
    }

    public static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.contains("//")) {
            normalized = normalized.replace("//", "/");
        }
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public static final class Builder {
        private final Map<String, byte[]> files = new TreeMap<>();
        private int overwrites;

        private Builder() {
        }

        /**
         * Adds or replaces a file (last writer wins).
         *
         * @return true when an existing file was replaced
         */
        public boolean put(String path, byte[] content) {
            byte[] previous = files.put(normalize(path), content.clone());
            if (previous != null) {
                overwrites++;
                return true;
            }
            return false;
        }

        public boolean put(String path, String content) {
            return put(path, content.getBytes(StandardCharsets.UTF_8));
        }

        public boolean contains(String path) {
            return files.containsKey(normalize(path));
        }

        public VirtualFileTree build() {
            return new VirtualFileTree(files, overwrites);
        }
    }
}
