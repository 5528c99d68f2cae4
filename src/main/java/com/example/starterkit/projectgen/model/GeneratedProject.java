package com.example.starterkit.projectgen.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fully assembled project, ready to hand to a packaging collaborator
 */
@Value
@Builder
public class GeneratedProject {
    String projectName;
    ResolvedFeatureSet resolved;
    VirtualFileTree files;
    SchemaMergeResult schema;
    List<VersionConflict> versionConflicts;
}
