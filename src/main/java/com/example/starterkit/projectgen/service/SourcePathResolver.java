package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.exception.ProjectAssemblyException;
import com.example.starterkit.projectgen.model.VirtualFileTree;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Resolves feature payload paths. "modules/..." and "core/..." are relative to
 * the project root; anything else is a legacy path relative to the core base.
 * Paths escaping both roots are rejected.
 */
@Component
public class SourcePathResolver {
    private static final String MODULES_PREFIX = "modules/";
    private static final String CORE_PREFIX = "core/";

    public Path resolve(String source, Path projectRoot, Path coreBase) {
        if (source == null || source.isBlank()) {
            throw new ProjectAssemblyException("Mapping without source", String.valueOf(source));
        }
        Path root = projectRoot.toAbsolutePath().normalize();
        Path base = coreBase.toAbsolutePath().normalize();
        String normalized = VirtualFileTree.normalize(source.trim());
        Path anchor = normalized.startsWith(MODULES_PREFIX) || normalized.startsWith(CORE_PREFIX) ? root : base;
        Path resolved = anchor.resolve(normalized).normalize();
        if (!resolved.startsWith(root) && !resolved.startsWith(base)) {
            throw new ProjectAssemblyException("Path traversal detected in mapping source", source);
        }
        return resolved;
    }
}
