package com.example.starterkit.projectgen.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Catalog entry for a single feature. Immutable once loaded; every list except
 * {@code requires} and {@code conflicts} may be null when the feature does not
 * contribute anything of that kind.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FeatureSpec {
    String slug;
    String name;
    String description;
    ModuleRef module;

    /**
     * Inactive features are hidden from catalog lookups
     */
    @Builder.Default
    boolean active = true;

    /**
     * Slugs of the features this one directly depends on
     */
    @Builder.Default
    List<String> requires = List.of();

    /**
     * Slugs of features that cannot be shipped together with this one
     */
    @Builder.Default
    List<String> conflicts = List.of();

    List<FileMapping> fileMappings;
    List<SchemaMapping> schemaMappings;
    List<EnvVarSpec> envVars;
    List<PackageSpec> npmPackages;

    /**
     * Extra package.json scripts contributed by the feature (name -> command)
     */
    Map<String, String> scripts;

    public List<String> requiresOrEmpty() {
        return requires != null ? requires : List.of();
    }

    public List<String> conflictsOrEmpty() {
        return conflicts != null ? conflicts : List.of();
    }

    public String category() {
        return module != null && module.getCategory() != null ? module.getCategory() : "general";
    }
}
