package com.example.starterkit.projectgen.catalog;

import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.exception.GenerationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads the feature catalog once at startup so the first generation request
 * does not pay for parsing it. A broken catalog is reported here but does not
 * stop the application; requests will surface the error again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogCacheWarmer {
    private final YamlFeatureCatalog catalog;
    private final ProjectGenProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void warmCache() {
        if (!properties.getCatalog().isWarmOnStartup()) {
            log.info("Catalog warming skipped (disabled)");
            return;
        }
        long start = System.currentTimeMillis();
        try {
            int count = catalog.allFeatures().size();
            log.info("Catalog warmed with {} feature(s) in {}ms", count, System.currentTimeMillis() - start);
        } catch (GenerationException e) {
            log.error("Failed to warm feature catalog [{}]: {}", e.getCode(), e.getDescription(), e);
        }
    }
}
