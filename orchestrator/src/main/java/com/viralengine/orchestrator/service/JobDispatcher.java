package com.viralengine.orchestrator.service;

import com.viralengine.orchestrator.model.JobSnapshot;
import com.viralengine.orchestrator.model.VideoRequest;
import com.viralengine.orchestrator.repository.JobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Accepts video requests and starts their pipelines in the background.
 *
 * submit() validates, creates the Job and hands {@link PipelineOrchestrator#run}
 * to a worker thread, then returns the PENDING snapshot straight away. The
 * caller never waits on a provider.
 *
 * At most viral.pipeline.worker-count pipelines run at once. Extra jobs
 * wait in the pool's queue as PENDING until a worker frees up.
 */
@Service
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore             jobStore;
    private final PipelineOrchestrator orchestrator;
    private final ExecutorService      workers;

    @Autowired
    public JobDispatcher(JobStore jobStore,
                         PipelineOrchestrator orchestrator,
                         @Value("${viral.pipeline.worker-count:4}") int workerCount) {
        this(jobStore, orchestrator, Executors.newFixedThreadPool(workerCount));
        log.info("Pipeline worker pool started with {} workers", workerCount);
    }

    JobDispatcher(JobStore jobStore, PipelineOrchestrator orchestrator, ExecutorService workers) {
        this.jobStore     = jobStore;
        this.orchestrator = orchestrator;
        this.workers      = workers;
    }

    /**
     * Create a job for this request and schedule its pipeline.
     *
     * @return the job as created: PENDING, progress 0
     * @throws JobValidationException if a required field is missing or invalid;
     *         no job is created in that case
     */
    public JobSnapshot submit(VideoRequest request) {
        validate(request);

        UUID id = jobStore.create(request);
        JobSnapshot created = jobStore.get(id).orElseThrow();

        try {
            workers.execute(() -> {
                try {
                    orchestrator.run(id);
                } catch (Throwable t) {
                    log.error("Unhandled error in pipeline for job {}: {}", id, t.getMessage(), t);
                    failIfUnfinished(id, t);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected job {}; marking it FAILED", id, e);
            return jobStore.update(id, job -> job.fail("pipeline failed: worker pool is not accepting jobs"));
        }

        log.info("Job {} submitted (topic='{}', voice={})", id, request.topic(), request.voiceId());
        return created;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Pipeline workers still busy at shutdown; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Leaves the job FAILED when run() escaped without reaching a terminal status. */
    private void failIfUnfinished(UUID id, Throwable cause) {
        try {
            JobSnapshot job = jobStore.get(id).orElse(null);
            if (job == null || job.isTerminal()) {
                return;
            }
            String reason = cause.getMessage() == null || cause.getMessage().isBlank()
                    ? cause.getClass().getSimpleName()
                    : cause.getMessage();
            jobStore.update(id, j -> j.fail("pipeline failed: " + reason));
        } catch (RuntimeException e) {
            log.error("Could not mark job {} FAILED after unhandled error", id, e);
        }
    }

    private static void validate(VideoRequest request) {
        if (request == null) {
            throw new JobValidationException(List.of("request body is required"));
        }
        List<String> violations = new ArrayList<>();
        if (isBlank(request.topic()))   violations.add("topic must not be empty");
        if (isBlank(request.voiceId())) violations.add("voiceId must not be empty");
        if (request.duration() <= 0)    violations.add("duration must be positive");
        if (isBlank(request.style()))   violations.add("style must not be empty");
        if (!violations.isEmpty()) {
            throw new JobValidationException(violations);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
