package com.viralengine.orchestrator.repository;

import com.viralengine.orchestrator.model.Job;
import com.viralengine.orchestrator.model.JobSnapshot;
import com.viralengine.orchestrator.model.VideoRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory {@link JobStore} backed by a ConcurrentHashMap.
 *
 * Stored Job objects are never mutated after they are published to the map.
 * {@link #update} runs inside {@code compute()}, which locks only the bin of
 * that key: the mutator works on a copy and the copy replaces the old record
 * when it returns. Jobs with different ids never wait on each other, and
 * {@link #get}/{@link #list} read without locking.
 *
 * Nothing is persisted; jobs are lost on restart.
 */
@Repository
public class InMemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private static final Comparator<JobSnapshot> CREATION_ORDER =
            Comparator.comparing(JobSnapshot::createdAt)
                      .thenComparing(JobSnapshot::id);

    private final ConcurrentHashMap<UUID, Job> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public UUID create(VideoRequest request) {
        UUID id = UUID.randomUUID();
        Job job = new Job(id, request, clock.instant());
        if (jobs.putIfAbsent(id, job) != null) {
            // Practically unreachable with random UUIDs; retry rather than overwrite.
            return create(request);
        }
        log.debug("Created job {} (topic='{}')", id, request.topic());
        return id;
    }

    @Override
    public Optional<JobSnapshot> get(UUID id) {
        Job job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(job.snapshot());
    }

    @Override
    public JobSnapshot update(UUID id, Consumer<Job> mutator) {
        Job updated = jobs.compute(id, (key, current) -> {
            if (current == null) {
                throw new JobNotFoundException(key);
            }
            Job next = current.copy();
            mutator.accept(next);
            next.touch(clock.instant());
            return next;
        });
        return updated.snapshot();
    }

    @Override
    public List<JobSnapshot> list() {
        return jobs.values().stream()
                .map(Job::snapshot)
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public int size() {
        return jobs.size();
    }
}
