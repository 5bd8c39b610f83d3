package com.viralengine.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Represents one video generation request and its accumulated results.
 *
 * A Job is only mutated on a private copy inside the JobStore (see
 * {@link com.viralengine.orchestrator.repository.JobStore#update}); the copy
 * replaces the stored record once the mutation succeeds, so readers never
 * see a half-applied change.
 *
 * The mutators enforce the lifecycle rules themselves:
 *   - status only moves forward one stage at a time, or to FAILED
 *   - progress never decreases
 *   - script, scenes, audioSegments and finalVideoPath are written once
 *   - a COMPLETED or FAILED job rejects every further change
 */
public class Job {

    private final UUID         id;
    private final VideoRequest request;
    private final Instant      createdAt;
    private Instant            updatedAt;

    private JobStatus status      = JobStatus.PENDING;
    private int       progress    = 0;
    private String    currentStep = "Initializing project...";

    // Stage outputs, null until the owning stage has produced them.
    private String       script;
    private List<Scene>  scenes;
    private List<String> audioSegments;
    private List<String> videoClips;
    private String       finalVideoPath;
    private String       videoUrl;

    // Set iff status == FAILED.
    private String error;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public Job(UUID id, VideoRequest request, Instant createdAt) {
        this.id        = id;
        this.request   = request;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    private Job(Job other) {
        this.id             = other.id;
        this.request        = other.request;
        this.createdAt      = other.createdAt;
        this.updatedAt      = other.updatedAt;
        this.status         = other.status;
        this.progress       = other.progress;
        this.currentStep    = other.currentStep;
        this.script         = other.script;
        this.scenes         = other.scenes;
        this.audioSegments  = other.audioSegments;
        this.videoClips     = other.videoClips == null ? null : new ArrayList<>(other.videoClips);
        this.finalVideoPath = other.finalVideoPath;
        this.videoUrl       = other.videoUrl;
        this.error          = other.error;
    }

    /** Working copy for a store update. Immutable lists are shared, the clip list is not. */
    public Job copy() {
        return new Job(this);
    }

    public JobSnapshot snapshot() {
        return new JobSnapshot(
                id, status, progress, currentStep, request,
                script, scenes, audioSegments,
                videoClips == null ? null : List.copyOf(videoClips),
                finalVideoPath, videoUrl, error,
                createdAt, updatedAt);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID         getId()             { return id; }
    public VideoRequest getRequest()        { return request; }
    public Instant      getCreatedAt()      { return createdAt; }
    public Instant      getUpdatedAt()      { return updatedAt; }
    public JobStatus    getStatus()         { return status; }
    public int          getProgress()       { return progress; }
    public String       getCurrentStep()    { return currentStep; }
    public String       getScript()         { return script; }
    public List<Scene>  getScenes()         { return scenes; }
    public List<String> getAudioSegments()  { return audioSegments; }
    public List<String> getVideoClips()     { return videoClips == null ? null : List.copyOf(videoClips); }
    public String       getFinalVideoPath() { return finalVideoPath; }
    public String       getVideoUrl()       { return videoUrl; }
    public String       getError()          { return error; }

    // ------------------------------------------------------------------
    // Lifecycle mutators
    // ------------------------------------------------------------------

    public void advanceTo(JobStatus next) {
        ensureMutable();
        if (next == JobStatus.FAILED) {
            throw new IllegalStateException("Use fail(error) to mark job " + id + " FAILED");
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    public void setProgress(int value) {
        ensureMutable();
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException("Progress out of range: " + value);
        }
        if (value < progress) {
            throw new IllegalStateException(
                    "Progress of job " + id + " cannot go back from " + progress + " to " + value);
        }
        progress = value;
    }

    public void setCurrentStep(String currentStep) {
        ensureMutable();
        this.currentStep = currentStep;
    }

    /** Write-once: set by the script stage. */
    public void recordScript(String script, List<Scene> scenes) {
        ensureMutable();
        ensureUnset(this.script, "script");
        ensureUnset(this.scenes, "scenes");
        this.script = script;
        this.scenes = List.copyOf(scenes);
    }

    /** Write-once: set by the audio stage. */
    public void recordAudioSegments(List<String> audioSegments) {
        ensureMutable();
        ensureUnset(this.audioSegments, "audioSegments");
        this.audioSegments = List.copyOf(audioSegments);
    }

    /** Opens the clip list at the start of the visual stage. */
    public void startVideoClips() {
        ensureMutable();
        ensureUnset(this.videoClips, "videoClips");
        this.videoClips = new ArrayList<>();
    }

    /** Appends the clip for the next scene; clips stay in scene order. */
    public void addVideoClip(String clip) {
        ensureMutable();
        if (status != JobStatus.GENERATING_VISUALS || videoClips == null) {
            throw new IllegalStateException(
                    "Job " + id + " is not collecting video clips (status " + status + ")");
        }
        videoClips.add(clip);
    }

    /** Write-once: final merged video, published together with the COMPLETED transition. */
    public void complete(String finalVideoPath, String videoUrl) {
        ensureMutable();
        ensureUnset(this.finalVideoPath, "finalVideoPath");
        if (!status.canTransitionTo(JobStatus.COMPLETED)) {
            throw new IllegalStateException(
                    "Job " + id + " cannot complete from " + status);
        }
        this.finalVideoPath = finalVideoPath;
        this.videoUrl       = videoUrl;
        this.progress       = 100;
        this.status         = JobStatus.COMPLETED;
        this.currentStep    = "Video ready";
    }

    public void fail(String error) {
        ensureMutable();
        this.status      = JobStatus.FAILED;
        this.error       = error;
        this.currentStep = "Error: " + error;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void ensureMutable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is " + status + " and can no longer change");
        }
    }

    private void ensureUnset(Object field, String name) {
        if (field != null) {
            throw new IllegalStateException("Job " + id + " already has " + name);
        }
    }
}
