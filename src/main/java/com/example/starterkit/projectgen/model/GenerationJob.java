package com.example.starterkit.projectgen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One generation run for an order. State changes are published through
 * volatile fields so status polls from request threads see the worker's
 * latest transition.
 */
@Getter
public class GenerationJob {
    private final String orderId;
    private final Instant submittedAt;

    @JsonIgnore
    private final CompletableFuture<GeneratedProject> completion = new CompletableFuture<>();

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String errorCode;
    private volatile String errorDescription;
    private volatile List<String> errorIdentifiers = List.of();

    @JsonIgnore
    private volatile GeneratedProject result;

    public GenerationJob(String orderId, Instant submittedAt) {
        this.orderId = orderId;
        this.submittedAt = submittedAt;
    }

    public void markRunning(Instant at) {
        this.startedAt = at;
        this.status = JobStatus.RUNNING;
    }

    public void markCompleted(GeneratedProject project, Instant at) {
        this.result = project;
        this.finishedAt = at;
        this.status = JobStatus.COMPLETED;
        completion.complete(project);
    }

    public void markFailed(String code, String description, List<String> identifiers, Throwable cause, Instant at) {
        this.errorCode = code;
        this.errorDescription = description;
        this.errorIdentifiers = identifiers != null ? List.copyOf(identifiers) : List.of();
        this.finishedAt = at;
        this.status = JobStatus.FAILED;
        completion.completeExceptionally(cause);
    }

    public String getProjectName() {
        GeneratedProject project = result;
        return project != null ? project.getProjectName() : null;
    }
}
