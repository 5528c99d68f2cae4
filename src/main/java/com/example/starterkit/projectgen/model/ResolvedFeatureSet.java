package com.example.starterkit.projectgen.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of feature resolution: the transitive closure of a selection.
 *
 * <p>Ordering matters downstream: {@code allFeatureSlugs} and {@code features}
 * list the selected features first, then template features, then features
 * pulled in as dependencies in discovery order. File overlays and package
 * versions are applied in this order, so later entries override earlier ones.
 */
@Value
@Builder
public class ResolvedFeatureSet {
    String tier;

    /**
     * Insertion-ordered, duplicate free
     */
    Set<String> allFeatureSlugs;

    /**
     * Catalog records in the same order as {@code allFeatureSlugs}
     */
    List<FeatureSpec> features;

    /**
     * slug -> direct requires, one entry per member slug
     */
    Map<String, List<String>> dependencyTree;

    /**
     * Dependency cycles found during resolution, each as a slug path that
     * starts and ends with the same slug
     */
    List<List<String>> cycles;

    /**
     * Pairs of member features that declare each other as conflicting
     */
    List<List<String>> conflicts;

    public boolean contains(String slug) {
        return allFeatureSlugs.contains(slug);
    }
}
