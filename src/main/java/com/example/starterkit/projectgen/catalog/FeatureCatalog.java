package com.example.starterkit.projectgen.catalog;

import com.example.starterkit.projectgen.model.FeatureSpec;

import java.util.List;
import java.util.Set;

/**
 * Read-only query port over the persisted feature catalog.
 */
public interface FeatureCatalog {

    /**
     * Look up active features by slug.
     *
     * @param slugs slugs to fetch
     * @return the features that exist, at most one per requested slug; callers
     *         infer missing slugs by diffing requested against returned
     * @throws com.example.starterkit.projectgen.exception.CatalogUnavailableException
     *         when the backing store cannot be queried
     */
    List<FeatureSpec> findFeatures(Set<String> slugs);
}
