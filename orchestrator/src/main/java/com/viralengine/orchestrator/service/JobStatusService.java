package com.viralengine.orchestrator.service;

import com.viralengine.orchestrator.model.JobSnapshot;
import com.viralengine.orchestrator.repository.JobNotFoundException;
import com.viralengine.orchestrator.repository.JobStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Read-only queries over the JobStore for polling clients.
 * Never blocks the pipeline workers.
 */
@Service
public class JobStatusService {

    private final JobStore jobStore;

    public JobStatusService(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    /** @throws JobNotFoundException if the id is unknown */
    public JobSnapshot getStatus(UUID id) {
        return jobStore.get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /** All jobs in creation order. */
    public List<JobSnapshot> listAll() {
        return jobStore.list();
    }
}
