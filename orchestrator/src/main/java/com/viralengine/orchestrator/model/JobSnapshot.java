package com.viralengine.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable point-in-time copy of a Job, handed out to every reader.
 *
 * Collection fields are unmodifiable copies, or null when the stage that
 * produces them has not run yet.
 */
public record JobSnapshot(
        UUID         id,
        JobStatus    status,
        int          progress,
        String       currentStep,
        VideoRequest request,
        String       script,
        List<Scene>  scenes,
        List<String> audioSegments,
        List<String> videoClips,
        String       finalVideoPath,
        String       videoUrl,
        String       error,
        Instant      createdAt,
        Instant      updatedAt
) {
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
