package com.example.starterkit.projectgen.catalog;

import com.example.starterkit.projectgen.config.GeneratorConfiguration;
import com.example.starterkit.projectgen.exception.CatalogLoadingException;
import com.example.starterkit.projectgen.exception.CatalogUnavailableException;
import com.example.starterkit.projectgen.model.FeatureSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the feature catalog from a YAML resource (classpath: or file:).
 * The parsed catalog is cached per location; evict after editing the file.
 */
@Slf4j
@Component
public class CatalogLoader {
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();

    /**
     * Load the catalog at the given location.
     *
     * @return active features keyed by slug, in file order
     * @throws CatalogUnavailableException if the resource is missing or unreadable
     * @throws CatalogLoadingException if the file is malformed or two entries share a slug
     */
    @Cacheable(value = GeneratorConfiguration.CATALOG_CACHE, key = "#location")
    public Map<String, FeatureSpec> loadCatalog(String location) {
        log.info("Loading feature catalog from {}", location);
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogUnavailableException(location, null);
        }

        CatalogDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = yamlMapper.readValue(in, CatalogDocument.class);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadingException("Malformed feature catalog " + location + ": "
                    + e.getOriginalMessage(), List.of(location));
        } catch (IOException e) {
            throw new CatalogUnavailableException(location, e);
        }

        Map<String, FeatureSpec> bySlug = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        int inactive = 0;
        if (document == null || document.getFeatures() == null) {
            log.warn("Feature catalog at {} is empty", location);
            return Collections.emptyMap();
        }
        for (FeatureSpec feature : document.getFeatures()) {
            if (feature.getSlug() == null || feature.getSlug().isBlank()) {
                throw new CatalogLoadingException("Catalog entry without slug in " + location, List.of(location));
            }
            if (bySlug.containsKey(feature.getSlug())) {
                duplicates.add(feature.getSlug());
                continue;
            }
            bySlug.put(feature.getSlug(), feature);
        }
        if (!duplicates.isEmpty()) {
            throw new CatalogLoadingException("Duplicate feature slugs in " + location, duplicates);
        }

        Map<String, FeatureSpec> active = new LinkedHashMap<>();
        for (FeatureSpec feature : bySlug.values()) {
            if (feature.isActive()) {
                active.put(feature.getSlug(), feature);
            } else {
                inactive++;
            }
        }
        log.info("Catalog loaded: {} active feature(s), {} inactive", active.size(), inactive);
        return Collections.unmodifiableMap(active);
    }

    @CacheEvict(value = GeneratorConfiguration.CATALOG_CACHE, allEntries = true)
    public void evictAll() {
        log.info("Feature catalog cache evicted");
    }
}
