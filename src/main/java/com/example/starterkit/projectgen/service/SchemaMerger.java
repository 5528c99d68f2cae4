package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.aspect.LogExecutionTime;
import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.exception.DuplicateModelException;
import com.example.starterkit.projectgen.exception.ProjectAssemblyException;
import com.example.starterkit.projectgen.model.SchemaMapping;
import com.example.starterkit.projectgen.model.SchemaMergeResult;
import com.example.starterkit.projectgen.model.SchemaValidation;
import com.example.starterkit.projectgen.model.VirtualFileTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Combines the base data-model schema with the fragments contributed by
 * features. Model and enum names are global: a name declared twice anywhere
 * aborts the merge.
 */
@Slf4j
@Service
public class SchemaMerger {
    static final String BASE_LABEL = "base schema";

    private static final Pattern BLOCK_HEADER =
            Pattern.compile("^\\s*(model|enum)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*\\{", Pattern.MULTILINE);

    private final SourcePathResolver pathResolver;
    private final ProjectGenProperties properties;

    public SchemaMerger(SourcePathResolver pathResolver, ProjectGenProperties properties) {
        this.pathResolver = pathResolver;
        this.properties = properties;
    }

    /**
     * Merge against the configured project root
     */
    public SchemaMergeResult mergeSchemas(String baseSchemaText, List<SchemaMapping> mappings) {
        return mergeSchemas(baseSchemaText, mappings,
                properties.getPaths().projectRootPath(), properties.getPaths().coreBasePath());
    }

    /**
     * Load every mapping's fragment and merge them onto the base schema in
     * mapping order. A source referenced by several mappings is read and
     * appended once.
     *
     * @throws DuplicateModelException if a model or enum name is declared twice
     * @throws ProjectAssemblyException if a schema file cannot be read
     */
    @LogExecutionTime("Schema merge")
    public SchemaMergeResult mergeSchemas(String baseSchemaText, List<SchemaMapping> mappings,
                                          Path projectRoot, Path coreBase) {
        Map<String, String> fragments = new LinkedHashMap<>();
        for (SchemaMapping mapping : mappings) {
            String label = labelOf(mapping);
            if (fragments.containsKey(label)) {
                log.debug("Schema source {} already merged, skipping mapping for {}", label, mapping.getModel());
                continue;
            }
            fragments.put(label, loadFragment(mapping, projectRoot, coreBase));
        }
        return merge(baseSchemaText, fragments);
    }

    /**
     * @param fragments fragment text keyed by a label naming its origin, in merge order
     */
    public SchemaMergeResult merge(String baseSchemaText, Map<String, String> fragments) {
        Map<String, String> declaredBy = new HashMap<>();
        List<String> models = new ArrayList<>();
        List<String> enums = new ArrayList<>();

        String base = baseSchemaText == null ? "" : baseSchemaText.trim();
        register(base, BASE_LABEL, declaredBy, models, enums);

        StringBuilder schema = new StringBuilder(base);
        for (Map.Entry<String, String> fragment : fragments.entrySet()) {
            String text = fragment.getValue() == null ? "" : fragment.getValue().trim();
            if (text.isEmpty()) {
                log.warn("Schema fragment {} is empty", fragment.getKey());
                continue;
            }
            int declared = register(text, fragment.getKey(), declaredBy, models, enums);
            if (declared == 0) {
                log.warn("Schema fragment {} declares no model or enum", fragment.getKey());
            }
            if (schema.length() > 0) {
                schema.append("\n\n");
            }
            schema.append("// ").append(fragment.getKey()).append('\n').append(text);
        }
        if (schema.length() > 0) {
            schema.append('\n');
        }

        log.info("Merged schema: {} model(s), {} enum(s) from {} fragment(s)",
                models.size(), enums.size(), fragments.size());
        return new SchemaMergeResult(schema.toString(), List.copyOf(models), List.copyOf(enums));
    }

    /**
     * Check that every required model made it into the merged schema. Missing
     * models are reported, not thrown.
     */
    public SchemaValidation validateSchemaCompleteness(SchemaMergeResult merged, Collection<String> requiredModels) {
        Set<String> declared = new HashSet<>(merged.getModels());
        declared.addAll(merged.getEnums());
        List<String> missing = new ArrayList<>();
        for (String required : requiredModels) {
            if (!declared.contains(required) && !missing.contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Merged schema is missing required model(s): {}", missing);
        }
        return new SchemaValidation(missing.isEmpty(), List.copyOf(missing));
    }

    static List<String[]> declarations(String text) {
        List<String[]> found = new ArrayList<>();
        Matcher matcher = BLOCK_HEADER.matcher(text);
        while (matcher.find()) {
            found.add(new String[]{matcher.group(1), matcher.group(2)});
        }
        return found;
    }

    private static int register(String text, String label, Map<String, String> declaredBy,
                                List<String> models, List<String> enums) {
        List<String[]> found = declarations(text);
        for (String[] declaration : found) {
            String name = declaration[1];
            String previous = declaredBy.putIfAbsent(name, label);
            if (previous != null) {
                throw new DuplicateModelException(name, previous, label);
            }
            if ("model".equals(declaration[0])) {
                models.add(name);
            } else {
                enums.add(name);
            }
        }
        return found.size();
    }

    private static String labelOf(SchemaMapping mapping) {
        if (mapping.isInline()) {
            return "inline " + mapping.getModel();
        }
        return mapping.getSource() == null ? "" : VirtualFileTree.normalize(mapping.getSource().trim());
    }

    private String loadFragment(SchemaMapping mapping, Path projectRoot, Path coreBase) {
        if (mapping.isInline()) {
            return mapping.getSource();
        }
        Path file = pathResolver.resolve(mapping.getSource(), projectRoot, coreBase);
        if (!Files.isRegularFile(file)) {
            throw new ProjectAssemblyException(
                    "Schema source for model '" + mapping.getModel() + "' not found", mapping.getSource());
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProjectAssemblyException("Failed to read schema source " + file, mapping.getSource(), e);
        }
    }
}
