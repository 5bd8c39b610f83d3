package com.viralengine.orchestrator.model;

/**
 * The four generation stages, in pipeline order.
 *
 * Each stage maps to one executor call (or one call per scene for VISUALS)
 * and to the JobStatus the job holds while that stage is running.
 */
public enum Stage {
    SCRIPT  (JobStatus.GENERATING_SCRIPT,  "script generation failed"),
    AUDIO   (JobStatus.GENERATING_AUDIO,   "audio generation failed"),
    VISUALS (JobStatus.GENERATING_VISUALS, "visual generation failed"),
    MERGE   (JobStatus.PROCESSING_VIDEO,   "video processing failed");

    private final JobStatus status;
    private final String    failurePrefix;

    Stage(JobStatus status, String failurePrefix) {
        this.status        = status;
        this.failurePrefix = failurePrefix;
    }

    public JobStatus status()        { return status; }
    public String    failurePrefix() { return failurePrefix; }
}
