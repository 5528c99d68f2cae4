package com.example.starterkit.projectgen.controller;

import com.example.starterkit.projectgen.catalog.CatalogCacheInspector;
import com.example.starterkit.projectgen.catalog.YamlFeatureCatalog;
import com.example.starterkit.projectgen.exception.GenerationException;
import com.example.starterkit.projectgen.model.FeatureSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/admin/catalog")
@RequiredArgsConstructor
public class AdminCatalogController {
    private final YamlFeatureCatalog catalog;
    private final CatalogCacheInspector cacheInspector;

    @GetMapping
    public ResponseEntity<?> listFeatures() {
        try {
            List<FeatureSpec> features = catalog.allFeatures();
            return ResponseEntity.ok(features);
        } catch (GenerationException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/cache")
    public ResponseEntity<?> inspectCache() {
        return ResponseEntity.ok(cacheInspector.inspect());
    }

    /**
     * Drop the cached catalog and load it again, so edits to the catalog file
     * take effect without a restart
     */
    @DeleteMapping("/cache")
    public ResponseEntity<?> reload() {
        try {
            catalog.reload();
            log.info("Feature catalog reloaded");
            return ResponseEntity.ok().build();
        } catch (GenerationException e) {
            return ErrorResponses.of(e);
        }
    }
}
