package com.viralengine.orchestrator.api;

import com.viralengine.orchestrator.api.dto.ErrorResponse;
import com.viralengine.orchestrator.api.dto.JobResponse;
import com.viralengine.orchestrator.api.dto.SubmitJobRequest;
import com.viralengine.orchestrator.model.JobSnapshot;
import com.viralengine.orchestrator.repository.JobNotFoundException;
import com.viralengine.orchestrator.service.JobDispatcher;
import com.viralengine.orchestrator.service.JobStatusService;
import com.viralengine.orchestrator.service.JobValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for video generation jobs.
 *
 * POST /jobs        submit a new video request; returns immediately with a PENDING job
 * GET  /jobs/{id}   poll status, progress and (when done) the video URL or error
 * GET  /jobs        list all jobs, oldest first
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobDispatcher    dispatcher;
    private final JobStatusService statusService;

    public JobController(JobDispatcher dispatcher, JobStatusService statusService) {
        this.dispatcher    = dispatcher;
        this.statusService = statusService;
    }

    /**
     * Submit a new video job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"topic":"cats","voiceId":"v1","duration":30,"style":"engaging"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        JobSnapshot job = dispatcher.submit(req.toVideoRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    /**
     * Poll the current state of a job.
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        try {
            return JobResponse.from(statusService.getStatus(id));
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping
    public List<JobResponse> listJobs() {
        return statusService.listAll().stream()
                .map(JobResponse::from)
                .toList();
    }

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<ErrorResponse> onInvalidRequest(JobValidationException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("Invalid video request", e.getViolations()));
    }
}
