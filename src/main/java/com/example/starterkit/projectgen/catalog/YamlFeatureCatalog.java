package com.example.starterkit.projectgen.catalog;

import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.model.FeatureSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link FeatureCatalog} backed by the YAML file configured under
 * {@code projectgen.catalog.location}.
 */
@Component
@RequiredArgsConstructor
public class YamlFeatureCatalog implements FeatureCatalog {
    private final CatalogLoader catalogLoader;
    private final ProjectGenProperties properties;

    @Override
    public List<FeatureSpec> findFeatures(Set<String> slugs) {
        Map<String, FeatureSpec> catalog = catalog();
        return slugs.stream()
                .map(catalog::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    public List<FeatureSpec> allFeatures() {
        return new ArrayList<>(catalog().values());
    }

    public void reload() {
        catalogLoader.evictAll();
        catalog();
    }

    private Map<String, FeatureSpec> catalog() {
        return catalogLoader.loadCatalog(properties.getCatalog().getLocation());
    }
}
