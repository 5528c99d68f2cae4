package com.example.starterkit.projectgen.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Application configuration for project generation.
 *
 * Example application.yml:
 *
 * projectgen:
 *   paths:
 *     project-root: /srv/starter-kit
 *   catalog:
 *     location: file:/srv/starter-kit/catalog/features.yaml
 *   resolver:
 *     max-attempts: 3
 *     retry-delay: 200ms
 *     reject-cycles: false
 *   jobs:
 *     pool-size: 4
 *     retention: 1h
 *   branding:
 *     product-name: Starter Studio
 */
@Data
@NoArgsConstructor
@Component
@ConfigurationProperties(prefix = "projectgen")
public class ProjectGenProperties {

    private Paths paths = new Paths();
    private Catalog catalog = new Catalog();
    private Resolver resolver = new Resolver();
    private Jobs jobs = new Jobs();
    private Branding branding = new Branding();

    @Data
    public static class Paths {
        /**
         * Directory holding core/ and modules/
         */
        private String projectRoot = ".";

        /**
         * Base tree copied into every project; defaults to {projectRoot}/core
         */
        private String coreBase;

        public Path projectRootPath() {
            return java.nio.file.Paths.get(projectRoot).toAbsolutePath().normalize();
        }

        public Path coreBasePath() {
            if (coreBase == null || coreBase.isBlank()) {
                return projectRootPath().resolve("core");
            }
            return java.nio.file.Paths.get(coreBase).toAbsolutePath().normalize();
        }
    }

    @Data
    public static class Catalog {
        /**
         * Spring resource location of the YAML feature catalog
         */
        private String location = "classpath:catalog/features.yaml";

        private boolean warmOnStartup = true;
    }

    @Data
    public static class Resolver {
        /**
         * Attempts per catalog batch before giving up
         */
        private int maxAttempts = 3;

        private Duration retryDelay = Duration.ofMillis(200);

        /**
         * Fail resolution on dependency cycles instead of returning the union
         */
        private boolean rejectCycles = false;
    }

    @Data
    public static class Jobs {
        private int poolSize = 4;

        /**
         * How long finished jobs stay queryable
         */
        private Duration retention = Duration.ofHours(1);
    }

    @Data
    public static class Branding {
        private String productName = "Starter Studio";
        private String website = "https://starter.example.com";
        private String docsUrl = "https://docs.starter.example.com";
    }
}
