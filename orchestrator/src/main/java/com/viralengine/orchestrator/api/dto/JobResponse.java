package com.viralengine.orchestrator.api.dto;

import com.viralengine.orchestrator.model.JobSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /jobs, GET /jobs/{id} and GET /jobs.
 *
 * videoUrl appears only once the job is COMPLETED, error only once it is FAILED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        UUID    id,
        String  status,
        int     progress,
        String  currentStep,
        String  videoUrl,
        String  error,
        Instant createdAt
) {
    public static JobResponse from(JobSnapshot job) {
        return new JobResponse(
                job.id(),
                job.status().name(),
                job.progress(),
                job.currentStep(),
                job.videoUrl(),
                job.error(),
                job.createdAt()
        );
    }
}
