package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.aspect.LogExecutionTime;
import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.exception.ProjectAssemblyException;
import com.example.starterkit.projectgen.model.FeatureSpec;
import com.example.starterkit.projectgen.model.FileMapping;
import com.example.starterkit.projectgen.model.VirtualFileTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the virtual file tree of a project: the core base tree first, then
 * every feature's file mappings in resolution order. A later write to the
 * same destination replaces the earlier one; that is how specific features
 * override generic defaults, so it is logged but never an error.
 */
@Slf4j
@Service
public class FileAssembler {
    private final FileInclusionPolicy inclusionPolicy;
    private final SourcePathResolver pathResolver;
    private final ProjectGenProperties properties;

    public FileAssembler(FileInclusionPolicy inclusionPolicy, SourcePathResolver pathResolver,
                         ProjectGenProperties properties) {
        this.inclusionPolicy = inclusionPolicy;
        this.pathResolver = pathResolver;
        this.properties = properties;
    }

    /**
     * Assemble against the configured project root
     */
    public VirtualFileTree assemble(Path baseTreeRoot, List<FeatureSpec> orderedFeatures) {
        return assemble(baseTreeRoot, properties.getPaths().projectRootPath(), orderedFeatures);
    }

    /**
     * @param baseTreeRoot core tree copied as the starting point
     * @param projectRoot root that "modules/..." and "core/..." sources resolve against
     * @param orderedFeatures features in resolver output order
     * @throws ProjectAssemblyException on any read failure, missing source or escaping path
     */
    @LogExecutionTime("File assembly")
    public VirtualFileTree assemble(Path baseTreeRoot, Path projectRoot, List<FeatureSpec> orderedFeatures) {
        Path base = baseTreeRoot.toAbsolutePath().normalize();
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            throw new ProjectAssemblyException("Base tree is not a directory", base.toString());
        }

        VirtualFileTree.Builder tree = VirtualFileTree.builder();
        int baseFiles = copyTree(tree, base, "", null);
        log.info("Copied {} file(s) from base tree {}", baseFiles, base);

        for (FeatureSpec feature : orderedFeatures) {
            if (feature.getFileMappings() == null || feature.getFileMappings().isEmpty()) {
                continue;
            }
            for (FileMapping mapping : feature.getFileMappings()) {
                Path source = pathResolver.resolve(mapping.getSource(), root, base);
                String destination = validateDestination(mapping.getDestination());
                int copied;
                if (Files.isDirectory(source)) {
                    copied = copyTree(tree, source, destination, feature.getSlug());
                } else if (Files.isRegularFile(source)) {
                    copied = copyFile(tree, source, destination, feature.getSlug()) ? 1 : 0;
                } else {
                    throw new ProjectAssemblyException(
                            "Feature '" + feature.getSlug() + "' maps a missing source", mapping.getSource());
                }
                log.debug("Feature '{}' contributed {} file(s) from {} to {}",
                        feature.getSlug(), copied, mapping.getSource(), destination.isEmpty() ? "/" : destination);
            }
        }

        VirtualFileTree result = tree.build();
        log.info("Assembled tree with {} file(s), {} overwrite(s)", result.size(), result.getOverwrites());
        return result;
    }

    static String validateDestination(String destination) {
        if (destination == null) {
            throw new ProjectAssemblyException("File mapping without destination", "null");
        }
        String normalized = VirtualFileTree.normalize(destination.trim());
        if (normalized.startsWith("/") || normalized.matches("^[A-Za-z]:.*")) {
            throw new ProjectAssemblyException("File mapping destination must be relative", destination);
        }
        for (String segment : normalized.split("/")) {
            if (segment.equals("..")) {
                throw new ProjectAssemblyException("Path traversal detected in file mapping destination", destination);
            }
        }
        return normalized;
    }

    private int copyTree(VirtualFileTree.Builder tree, Path sourceDir, String destination, String featureSlug) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(sourceDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(sourceDir) && !inclusionPolicy.shouldIncludeFile(relative(sourceDir, dir))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && inclusionPolicy.shouldIncludeFile(relative(sourceDir, file))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ProjectAssemblyException("Failed to walk " + sourceDir, sourceDir.toString(), e);
        }
        Collections.sort(files);

        int copied = 0;
        for (Path file : files) {
            String target = destination.isEmpty()
                    ? relative(sourceDir, file)
                    : destination + "/" + relative(sourceDir, file);
            if (copyFile(tree, file, target, featureSlug)) {
                copied++;
            }
        }
        return copied;
    }

    private boolean copyFile(VirtualFileTree.Builder tree, Path file, String target, String featureSlug) {
        if (!inclusionPolicy.shouldIncludeFile(target)) {
            log.debug("Excluded {}", target);
            return false;
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ProjectAssemblyException("Failed to read " + file, file.toString(), e);
        }
        if (tree.put(target, content)) {
            log.debug("Feature '{}' overrides {}", featureSlug, target);
        }
        return true;
    }

    private static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
