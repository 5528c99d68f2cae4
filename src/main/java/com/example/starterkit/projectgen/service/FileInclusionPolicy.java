package com.example.starterkit.projectgen.service;

import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides which files of the core tree and feature payloads ship in a
 * generated project. Rules apply per path segment: a path is dropped when any
 * segment is an excluded directory or the last segment is an excluded file.
 */
@Component
public class FileInclusionPolicy {

    /**
     * Build output, VCS metadata, dependency caches, coverage and the
     * configurator's live-preview code
     */
    static final Set<String> EXCLUDED_DIRS = Set.of(
            "node_modules",
            ".git",
            "dist",
            "build",
            ".next",
            ".turbo",
            "coverage",
            ".nyc_output",
            "_preview"
    );

    static final Set<String> EXCLUDED_FILES = Set.of(
            ".DS_Store",
            "Thumbs.db",
            "preview-banner.tsx",
            "preview-wrapper.tsx",
            "preview-context.tsx"
    );

    static final String ENV_FILE = ".env";
    static final String ENV_EXAMPLE = ".env.example";
    static final String LOG_SUFFIX = ".log";

    public boolean shouldIncludeFile(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return false;
        }
        String[] segments = relativePath.replace('\\', '/').split("/");
        String baseName = null;
        for (String segment : segments) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (EXCLUDED_DIRS.contains(segment)) {
                return false;
            }
            baseName = segment;
        }
        return baseName != null && isIncludedFileName(baseName);
    }

    private static boolean isIncludedFileName(String name) {
        if (EXCLUDED_FILES.contains(name) || name.endsWith(LOG_SUFFIX)) {
            return false;
        }
        if (name.equals(ENV_FILE)) {
            return false;
        }
        return !name.startsWith(ENV_FILE + ".") || name.equals(ENV_EXAMPLE);
    }
}
