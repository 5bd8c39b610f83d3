package com.viralengine.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lifecycle rules enforced by Job itself: forward-only status,
 * non-decreasing progress, write-once outputs, terminal immutability.
 */
class JobTest {

    @Test
    void newJob_isPendingAtZero() {
        Job job = newJob();

        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getProgress()).isZero();
        assertThat(job.getScript()).isNull();
        assertThat(job.getVideoClips()).isNull();
        assertThat(job.getError()).isNull();
    }

    @Test
    void advanceTo_skippingAStage_isRejected() {
        Job job = newJob();

        assertThatThrownBy(() -> job.advanceTo(JobStatus.GENERATING_AUDIO))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PENDING")
                .hasMessageContaining("GENERATING_AUDIO");
    }

    @Test
    void advanceTo_completedDirectlyFromPending_isRejected() {
        Job job = newJob();

        assertThatThrownBy(() -> job.advanceTo(JobStatus.COMPLETED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void setProgress_neverGoesBackwards() {
        Job job = newJob();
        job.setProgress(25);

        assertThatThrownBy(() -> job.setProgress(10))
                .isInstanceOf(IllegalStateException.class);
        assertThat(job.getProgress()).isEqualTo(25);
    }

    @Test
    void setProgress_outOfRange_isRejected() {
        Job job = newJob();

        assertThatThrownBy(() -> job.setProgress(101)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recordScript_isWriteOnce() {
        Job job = newJob();
        job.recordScript("first", List.of(Scene.of("a")));

        assertThatThrownBy(() -> job.recordScript("second", List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("script");
        assertThat(job.getScript()).isEqualTo("first");
    }

    @Test
    void addVideoClip_outsideVisualStage_isRejected() {
        Job job = newJob();

        assertThatThrownBy(() -> job.addVideoClip("clip.mp4"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fail_setsErrorAndFreezesJob() {
        Job job = newJob();
        job.advanceTo(JobStatus.GENERATING_SCRIPT);

        job.fail("script generation failed: boom");

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("script generation failed: boom");
        assertThat(job.getCurrentStep()).isEqualTo("Error: script generation failed: boom");
        assertThatThrownBy(() -> job.setCurrentStep("again")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> job.fail("twice")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void complete_onlyFromProcessingVideo() {
        Job job = newJob();

        assertThatThrownBy(() -> job.complete("/out/final.mp4", "/api/download/x"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(job.getFinalVideoPath()).isNull();
    }

    @Test
    void complete_fromProcessingVideo_publishesResult() {
        Job job = walkTo(JobStatus.PROCESSING_VIDEO);

        job.complete("/out/final.mp4", "/api/download/" + job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getCurrentStep()).isEqualTo("Video ready");
        assertThat(job.getVideoUrl()).endsWith(job.getId().toString());
        assertThatThrownBy(() -> job.setProgress(100)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void copy_doesNotShareClipList() {
        Job job = walkTo(JobStatus.GENERATING_VISUALS);
        job.startVideoClips();
        job.addVideoClip("clip-0.mp4");

        Job copy = job.copy();
        copy.addVideoClip("clip-1.mp4");

        assertThat(job.getVideoClips()).containsExactly("clip-0.mp4");
        assertThat(copy.getVideoClips()).containsExactly("clip-0.mp4", "clip-1.mp4");
    }

    @Test
    void snapshot_isDetachedFromLaterChanges() {
        Job job = walkTo(JobStatus.GENERATING_VISUALS);
        job.startVideoClips();
        job.addVideoClip("clip-0.mp4");

        JobSnapshot snap = job.snapshot();
        job.addVideoClip("clip-1.mp4");

        assertThat(snap.videoClips()).containsExactly("clip-0.mp4");
        assertThatThrownBy(() -> snap.videoClips().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void videoRequest_defaultsOptionalFields() {
        VideoRequest req = new VideoRequest("cats", "v1", null, " ");

        assertThat(req.duration()).isEqualTo(60);
        assertThat(req.style()).isEqualTo("engaging");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Job newJob() {
        return new Job(UUID.randomUUID(), new VideoRequest("cats", "v1", 30, "engaging"), Instant.now());
    }

    private static Job walkTo(JobStatus target) {
        Job job = newJob();
        for (JobStatus s : JobStatus.values()) {
            if (s == JobStatus.PENDING) continue;
            job.advanceTo(s);
            if (s == target) break;
        }
        return job;
    }
}
