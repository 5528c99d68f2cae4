package com.example.starterkit.projectgen.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON view of a generated project returned by the REST API
 */
@Value
@Builder
public class GenerationSummary {
    String projectName;
    String tier;
    Set<String> features;
    Map<String, List<String>> dependencyTree;
    List<List<String>> cycles;
    List<String> files;
    List<String> models;
    List<VersionConflict> versionConflicts;

    public static GenerationSummary of(GeneratedProject project) {
        return GenerationSummary.builder()
                .projectName(project.getProjectName())
                .tier(project.getResolved().getTier())
                .features(project.getResolved().getAllFeatureSlugs())
                .dependencyTree(project.getResolved().getDependencyTree())
                .cycles(project.getResolved().getCycles())
                .files(project.getFiles().paths())
                .models(project.getSchema().getModels())
                .versionConflicts(project.getVersionConflicts())
                .build();
    }
}
