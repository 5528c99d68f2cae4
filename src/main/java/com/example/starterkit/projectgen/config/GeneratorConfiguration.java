package com.example.starterkit.projectgen.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Infrastructure beans shared by the generation pipeline
 */
@Configuration
@EnableCaching
public class GeneratorConfiguration {

    public static final String CATALOG_CACHE = "featureCatalog";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(ProjectGenProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getJobs().getPoolSize());
        executor.setMaxPoolSize(properties.getJobs().getPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("projectgen-");
        executor.initialize();
        return executor;
    }
}
