package com.viralengine.orchestrator.repository;

import com.viralengine.orchestrator.model.Job;
import com.viralengine.orchestrator.model.JobSnapshot;
import com.viralengine.orchestrator.model.VideoRequest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Keyed registry of Job records shared by the dispatcher, the pipeline
 * workers and the status API.
 *
 * Readers always get an independent {@link JobSnapshot}; writers go through
 * {@link #update}, which applies the change atomically for that one job.
 */
public interface JobStore {

    /** Insert a new PENDING job for this request and return its id. */
    UUID create(VideoRequest request);

    Optional<JobSnapshot> get(UUID id);

    /**
     * Apply {@code mutator} to the job under exclusive access to that job only.
     *
     * If the mutator throws, the stored job is left unchanged and the
     * exception propagates to the caller.
     *
     * @throws JobNotFoundException if no job has this id
     */
    JobSnapshot update(UUID id, Consumer<Job> mutator);

    /** All jobs, oldest first. */
    List<JobSnapshot> list();

    int size();
}
