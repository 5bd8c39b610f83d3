package com.viralengine.orchestrator.model;

/**
 * States of the video generation pipeline for a Job.
 *
 * Transitions (happy path):
 *   PENDING → GENERATING_SCRIPT → GENERATING_AUDIO → GENERATING_VISUALS
 *           → PROCESSING_VIDEO → COMPLETED
 *
 * Any non-terminal state can transition directly to FAILED.
 * COMPLETED and FAILED are terminal: no further transitions.
 */
public enum JobStatus {
    PENDING,
    GENERATING_SCRIPT,
    GENERATING_AUDIO,
    GENERATING_VISUALS,
    PROCESSING_VIDEO,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * True if {@code next} is the immediate successor of this state,
     * or FAILED from any non-terminal state.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return next.ordinal() == ordinal() + 1;
    }
}
