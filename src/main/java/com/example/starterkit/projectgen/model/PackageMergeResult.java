package com.example.starterkit.projectgen.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class PackageMergeResult {
    /**
     * Merged package.json content; nested maps keep a deterministic order
     */
    Map<String, Object> manifest;
    List<VersionConflict> versionConflicts;
    List<String> addedDependencies;
    List<String> addedDevDependencies;
}
