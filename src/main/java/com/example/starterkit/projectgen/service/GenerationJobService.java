package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.exception.GenerationException;
import com.example.starterkit.projectgen.model.GeneratedProject;
import com.example.starterkit.projectgen.model.GenerationJob;
import com.example.starterkit.projectgen.model.OrderDetails;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs generation in the background, one run per order at a time. Submitting
 * an order whose run is still queued or running returns that run instead of
 * starting another one; finished runs are kept for a configurable retention
 * period so their status can still be polled.
 */
@Slf4j
@Service
public class GenerationJobService {
    public static final String GENERATION_FAILED = "GENERATION_FAILED";
    public static final String JOB_REJECTED = "JOB_REJECTED";

    private final ProjectGenerator projectGenerator;
    private final Executor executor;
    private final Clock clock;

    private final ConcurrentMap<String, GenerationJob> inFlight = new ConcurrentHashMap<>();
    private final Cache<String, GenerationJob> finished;

    public GenerationJobService(ProjectGenerator projectGenerator,
                                @Qualifier("generationExecutor") Executor executor,
                                Clock clock,
                                ProjectGenProperties properties) {
        this.projectGenerator = projectGenerator;
        this.executor = executor;
        this.clock = clock;
        this.finished = Caffeine.newBuilder()
                .expireAfterWrite(properties.getJobs().getRetention())
                .build();
    }

    /**
     * @throws IllegalArgumentException if the order has no id
     */
    public GenerationJob submit(OrderDetails order) {
        String orderId = requireOrderId(order);
        GenerationJob[] created = new GenerationJob[1];
        GenerationJob job = inFlight.compute(orderId, (id, existing) -> {
            if (existing != null && !existing.getStatus().isFinished()) {
                return existing;
            }
            created[0] = new GenerationJob(id, clock.instant());
            return created[0];
        });

        if (created[0] == null) {
            log.info("Order {} already has a {} generation job, coalescing", orderId, job.getStatus());
            return job;
        }

        log.info("Queued generation job for order {}", orderId);
        try {
            executor.execute(() -> run(job, order));
        } catch (RejectedExecutionException e) {
            log.error("Generation executor rejected job for order {}", orderId, e);
            job.markFailed(JOB_REJECTED, "Generation queue is full", List.of(orderId), e, clock.instant());
            retire(job);
        }
        return job;
    }

    public Optional<GenerationJob> find(String orderId) {
        GenerationJob running = inFlight.get(orderId);
        if (running != null) {
            return Optional.of(running);
        }
        return Optional.ofNullable(finished.getIfPresent(orderId));
    }

    /**
     * Submit (or join the order's current run) and block until it finishes
     *
     * @throws GenerationException when the run failed with a classified error
     */
    public GeneratedProject generateAndWait(OrderDetails order) {
        GenerationJob job = submit(order);
        try {
            return job.getCompletion().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private void run(GenerationJob job, OrderDetails order) {
        job.markRunning(clock.instant());
        try {
            GeneratedProject project = projectGenerator.generate(order);
            job.markCompleted(project, clock.instant());
            log.info("Generation job for order {} completed: {}", job.getOrderId(), project.getProjectName());
        } catch (GenerationException e) {
            log.warn("Generation job for order {} failed: {}", job.getOrderId(), e.getMessage());
            job.markFailed(e.getCode(), e.getDescription(), e.getIdentifiers(), e, clock.instant());
        } catch (RuntimeException e) {
            log.error("Generation job for order {} failed unexpectedly", job.getOrderId(), e);
            job.markFailed(GENERATION_FAILED, String.valueOf(e.getMessage()), List.of(), e, clock.instant());
        } catch (Error e) {
            // record the failure so waiters are released, then let the worker thread see the error
            log.error("Generation job for order {} aborted", job.getOrderId(), e);
            job.markFailed(GENERATION_FAILED, String.valueOf(e), List.of(), e, clock.instant());
            throw e;
        } finally {
            retire(job);
        }
    }

    /**
     * Move a finished job from in-flight to retained. A job that has already
     * been replaced by a newer run for the same order is not retained, so a
     * late retire never hides the newer run's record.
     */
    private void retire(GenerationJob job) {
        inFlight.compute(job.getOrderId(), (id, current) -> {
            if (current == null || current == job) {
                finished.asMap().merge(id, job, (retained, candidate) ->
                        candidate.getSubmittedAt().isBefore(retained.getSubmittedAt()) ? retained : candidate);
                return null;
            }
            return current;
        });
    }

    private static String requireOrderId(OrderDetails order) {
        if (order == null || order.getId() == null || order.getId().isBlank()) {
            throw new IllegalArgumentException("Order id is required");
        }
        return order.getId();
    }
}
