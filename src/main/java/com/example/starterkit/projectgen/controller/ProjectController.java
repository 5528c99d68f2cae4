package com.example.starterkit.projectgen.controller;

import com.example.starterkit.projectgen.exception.GenerationException;
import com.example.starterkit.projectgen.model.GeneratedProject;
import com.example.starterkit.projectgen.model.GenerationJob;
import com.example.starterkit.projectgen.model.GenerationSummary;
import com.example.starterkit.projectgen.model.JobStatus;
import com.example.starterkit.projectgen.model.OrderDetails;
import com.example.starterkit.projectgen.model.ResolveRequest;
import com.example.starterkit.projectgen.model.ResolvedFeatureSet;
import com.example.starterkit.projectgen.service.FeatureResolver;
import com.example.starterkit.projectgen.service.GenerationJobService;
import com.example.starterkit.projectgen.service.ProjectGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * REST API for feature resolution and project generation
 */
@Slf4j
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {
    private final FeatureResolver featureResolver;
    private final ProjectGenerator projectGenerator;
    private final GenerationJobService jobService;

    /**
     * Dry-run resolution: returns the closure of the requested features
     * without assembling anything.
     *
     * POST /api/projects/resolve
     * {
     *   "selectedFeatures": ["auth.social"],
     *   "tier": "pro",
     *   "templateFeatures": []
     * }
     */
    @PostMapping("/resolve")
    public ResponseEntity<?> resolve(@RequestBody ResolveRequest request) {
        log.info("Resolving features {} for tier {}", request.getSelectedFeatures(), request.getTier());
        try {
            ResolvedFeatureSet resolved = featureResolver.resolve(
                    nullToEmpty(request.getSelectedFeatures()), request.getTier(),
                    nullToEmpty(request.getTemplateFeatures()));
            return ResponseEntity.ok(resolved);
        } catch (GenerationException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * Generate synchronously and return a summary of the project. Orders with
     * an id share the job queue's one-run-per-order guarantee.
     */
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody OrderDetails order) {
        log.info("Received generation request for order {}", order.getOrderNumber());
        try {
            GeneratedProject project = order.getId() != null && !order.getId().isBlank()
                    ? jobService.generateAndWait(order)
                    : projectGenerator.generate(order);
            return ResponseEntity.ok(GenerationSummary.of(project));
        } catch (GenerationException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/jobs")
    public ResponseEntity<?> submitJob(@RequestBody OrderDetails order) {
        try {
            GenerationJob job = jobService.submit(order);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e.getMessage());
        }
    }

    @GetMapping("/jobs/{orderId}")
    public ResponseEntity<?> getJob(@PathVariable String orderId) {
        Optional<GenerationJob> job = jobService.find(orderId);
        if (job.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(job.get());
    }

    /**
     * Download one file of a completed job's project
     *
     * GET /api/projects/jobs/{orderId}/files?path=backend/package.json
     */
    @GetMapping("/jobs/{orderId}/files")
    public ResponseEntity<?> getJobFile(@PathVariable String orderId, @RequestParam String path) {
        Optional<GenerationJob> found = jobService.find(orderId);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        GenerationJob job = found.get();
        if (job.getStatus() == JobStatus.FAILED) {
            return ErrorResponses.of(job.getErrorCode(), job.getErrorDescription(), job.getErrorIdentifiers());
        }
        if (job.getStatus() != JobStatus.COMPLETED) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body("Job for order " + orderId + " is " + job.getStatus());
        }

        Optional<byte[]> content = job.getResult().getFiles().read(path);
        if (content.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setContentLength(content.get().length);
        return new ResponseEntity<>(content.get(), headers, HttpStatus.OK);
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Project generation service is running");
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
