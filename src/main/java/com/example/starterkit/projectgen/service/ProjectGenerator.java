package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.aspect.LogExecutionTime;
import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.exception.ProjectAssemblyException;
import com.example.starterkit.projectgen.model.FeatureSpec;
import com.example.starterkit.projectgen.model.GeneratedProject;
import com.example.starterkit.projectgen.model.OrderDetails;
import com.example.starterkit.projectgen.model.PackageMergeResult;
import com.example.starterkit.projectgen.model.PackageTarget;
import com.example.starterkit.projectgen.model.ResolvedFeatureSet;
import com.example.starterkit.projectgen.model.SchemaMapping;
import com.example.starterkit.projectgen.model.SchemaMergeResult;
import com.example.starterkit.projectgen.model.VersionConflict;
import com.example.starterkit.projectgen.model.VirtualFileTree;
import com.example.starterkit.projectgen.util.JsonFormatting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the generation pipeline for one order: resolve features, assemble the
 * file tree, merge schema and manifests, then write the generated documents
 * over the assembled tree.
 */
@Slf4j
@Service
public class ProjectGenerator {
    static final String SCHEMA_PATH = "backend/prisma/schema.prisma";
    static final String BACKEND_MANIFEST = "backend/package.json";
    static final String WEB_MANIFEST = "web/package.json";
    static final String ENV_EXAMPLE = "backend/.env.example";
    static final String LICENSE = "LICENSE.md";
    static final String README = "README.md";
    static final String CONFIG = "starter-config.json";

    private final FeatureResolver featureResolver;
    private final FileAssembler fileAssembler;
    private final SchemaMerger schemaMerger;
    private final PackageManifestMerger packageMerger;
    private final ProjectDocumentGenerator documentGenerator;
    private final ProjectGenProperties properties;

    public ProjectGenerator(FeatureResolver featureResolver,
                            FileAssembler fileAssembler,
                            SchemaMerger schemaMerger,
                            PackageManifestMerger packageMerger,
                            ProjectDocumentGenerator documentGenerator,
                            ProjectGenProperties properties) {
        this.featureResolver = featureResolver;
        this.fileAssembler = fileAssembler;
        this.schemaMerger = schemaMerger;
        this.packageMerger = packageMerger;
        this.documentGenerator = documentGenerator;
        this.properties = properties;
    }

    @LogExecutionTime("Project generation")
    public GeneratedProject generate(OrderDetails order) {
        return generate(order, properties.getPaths().coreBasePath(), properties.getPaths().projectRootPath());
    }

    public GeneratedProject generate(OrderDetails order, Path coreBase, Path projectRoot) {
        String projectName = documentGenerator.generateProjectName(order);
        log.info("Generating project {} for order {}", projectName, order.getOrderNumber());

        ResolvedFeatureSet resolved = featureResolver.resolve(
                order.getSelectedFeatures(), order.getTier(), order.templateFeatures());
        List<FeatureSpec> features = resolved.getFeatures();

        VirtualFileTree tree = fileAssembler.assemble(coreBase, projectRoot, features);
        VirtualFileTree.Builder assembled = tree.toBuilder();

        String baseSchema = tree.readString(SCHEMA_PATH).orElseGet(() -> {
            log.warn("Core tree has no {}, merging feature fragments only", SCHEMA_PATH);
            return "";
        });
        List<SchemaMapping> schemaMappings = collectSchemaMappings(features);
        SchemaMergeResult schema = schemaMerger.mergeSchemas(baseSchema, schemaMappings, projectRoot, coreBase);
        schemaMerger.validateSchemaCompleteness(schema, requiredModels(schemaMappings));
        assembled.put(SCHEMA_PATH, schema.getSchema());

        List<VersionConflict> conflicts = new ArrayList<>();

        Map<String, Object> backendBase = readManifest(tree.read(BACKEND_MANIFEST), BACKEND_MANIFEST)
                .orElseThrow(() -> new ProjectAssemblyException("Core tree has no backend manifest", BACKEND_MANIFEST));
        backendBase.put(PackageManifestMerger.SCRIPTS, packageMerger.generateScripts(
                PackageManifestMerger.stringMap(backendBase.get(PackageManifestMerger.SCRIPTS)), features));
        PackageMergeResult backend = packageMerger.mergePackageJson(
                backendBase, packageMerger.contributionsFor(features, PackageTarget.BACKEND), projectName);
        assembled.put(BACKEND_MANIFEST, packageMerger.stringifyPackageJson(backend.getManifest()));
        conflicts.addAll(backend.getVersionConflicts());

        Optional<Map<String, Object>> webBase = readManifest(tree.read(WEB_MANIFEST), WEB_MANIFEST);
        if (webBase.isPresent()) {
            PackageMergeResult web = packageMerger.mergePackageJson(
                    webBase.get(), packageMerger.contributionsFor(features, PackageTarget.WEB), projectName);
            assembled.put(WEB_MANIFEST, packageMerger.stringifyPackageJson(web.getManifest()));
            conflicts.addAll(web.getVersionConflicts());
        } else {
            log.warn("Core tree has no {}, web manifest not generated", WEB_MANIFEST);
        }

        assembled.put(ENV_EXAMPLE, documentGenerator.generateEnvExample(features));
        assembled.put(LICENSE, documentGenerator.generateLicense(order));
        assembled.put(README, documentGenerator.generateReadme(order, features));
        assembled.put(CONFIG, documentGenerator.generateConfig(order, features));

        GeneratedProject project = GeneratedProject.builder()
                .projectName(projectName)
                .resolved(resolved)
                .files(assembled.build())
                .schema(schema)
                .versionConflicts(List.copyOf(conflicts))
                .build();
        log.info("Generated project {}: {} feature(s), {} file(s), {} model(s)", projectName,
                features.size(), project.getFiles().size(), schema.getModels().size());
        return project;
    }

    static List<SchemaMapping> collectSchemaMappings(List<FeatureSpec> features) {
        List<SchemaMapping> mappings = new ArrayList<>();
        for (FeatureSpec feature : features) {
            if (feature.getSchemaMappings() != null) {
                mappings.addAll(feature.getSchemaMappings());
            }
        }
        return mappings;
    }

    private static Set<String> requiredModels(List<SchemaMapping> mappings) {
        Set<String> models = new LinkedHashSet<>();
        for (SchemaMapping mapping : mappings) {
            if (mapping.getModel() != null && !mapping.getModel().isBlank()) {
                models.add(mapping.getModel().trim());
            }
        }
        return models;
    }

    private static Optional<Map<String, Object>> readManifest(Optional<byte[]> content, String path) {
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonFormatting.parseObject(content.get()));
        } catch (IOException e) {
            throw new ProjectAssemblyException("Malformed package manifest", path, e);
        }
    }
}
