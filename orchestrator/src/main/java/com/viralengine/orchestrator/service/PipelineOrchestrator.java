package com.viralengine.orchestrator.service;

import com.viralengine.orchestrator.executor.AudioExecutor;
import com.viralengine.orchestrator.executor.ExecutorException;
import com.viralengine.orchestrator.executor.MergeExecutor;
import com.viralengine.orchestrator.executor.ScriptExecutor;
import com.viralengine.orchestrator.executor.VisualExecutor;
import com.viralengine.orchestrator.model.JobSnapshot;
import com.viralengine.orchestrator.model.JobStatus;
import com.viralengine.orchestrator.model.Scene;
import com.viralengine.orchestrator.model.ScriptResult;
import com.viralengine.orchestrator.model.Stage;
import com.viralengine.orchestrator.model.VideoRequest;
import com.viralengine.orchestrator.repository.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives one Job through the generation pipeline.
 *
 *   PENDING → GENERATING_SCRIPT → GENERATING_AUDIO → GENERATING_VISUALS
 *           → PROCESSING_VIDEO → COMPLETED
 *
 * Each stage feeds the next: scenes come from the script, and the merge
 * needs one clip per scene in scene order. Progress is written at fixed
 * checkpoints (10, 25, 45, 70, 80, 100) rather than computed, because
 * provider latency is unpredictable.
 *
 * Executor failures are caught once, at the stage boundary, and turned
 * into FAILED with a stage-attributed error. There is no retry. The store
 * is never locked while a provider call is outstanding: every update is a
 * short synchronous write before or after the call.
 *
 * One run() call owns all writes to its job after dispatch.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final int SCRIPT_STARTED  = 10;
    static final int SCRIPT_DONE     = 25;
    static final int AUDIO_DONE      = 45;
    static final int VISUALS_DONE    = 70;
    static final int MERGE_STARTED   = 80;

    private final JobStore       jobStore;
    private final ScriptExecutor scriptExecutor;
    private final AudioExecutor  audioExecutor;
    private final VisualExecutor visualExecutor;
    private final MergeExecutor  mergeExecutor;
    private final MeterRegistry  meterRegistry;
    private final int            scenePreviewLength;
    private final String         downloadPath;

    public PipelineOrchestrator(JobStore jobStore,
                                ScriptExecutor scriptExecutor,
                                AudioExecutor audioExecutor,
                                VisualExecutor visualExecutor,
                                MergeExecutor mergeExecutor,
                                MeterRegistry meterRegistry,
                                @Value("${viral.pipeline.scene-preview-length:50}") int scenePreviewLength,
                                @Value("${viral.pipeline.download-path:/api/download/}") String downloadPath) {
        this.jobStore           = jobStore;
        this.scriptExecutor     = scriptExecutor;
        this.audioExecutor      = audioExecutor;
        this.visualExecutor     = visualExecutor;
        this.mergeExecutor      = mergeExecutor;
        this.meterRegistry      = meterRegistry;
        this.scenePreviewLength = scenePreviewLength;
        this.downloadPath       = downloadPath;
    }

    // ------------------------------------------------------------------
    // Entry point: called by JobDispatcher on a pipeline worker thread
    // ------------------------------------------------------------------

    /**
     * Run every stage for the job, leaving it COMPLETED or FAILED.
     *
     * Only PENDING jobs are run; anything else is logged and skipped.
     */
    public void run(UUID jobId) {
        MDC.put("jobId", jobId.toString());
        Stage current = null;
        try {
            Optional<JobSnapshot> found = jobStore.get(jobId);
            if (found.isEmpty()) {
                log.error("Job {} vanished before the pipeline started", jobId);
                return;
            }
            if (found.get().status() != JobStatus.PENDING) {
                log.warn("Job {} is {}, not PENDING; pipeline not started", jobId, found.get().status());
                return;
            }
            VideoRequest request = found.get().request();
            log.info("Starting pipeline: job={} topic='{}' duration={}s style={}",
                    jobId, request.topic(), request.duration(), request.style());

            current = Stage.SCRIPT;
            ScriptResult script = timed(current, () -> runScriptStage(jobId, request));

            current = Stage.AUDIO;
            List<String> audio = timed(current, () -> runAudioStage(jobId, request, script.script()));

            current = Stage.VISUALS;
            List<String> clips = timed(current, () -> runVisualStage(jobId, request, script.scenes()));

            current = Stage.MERGE;
            timed(current, () -> runMergeStage(jobId, script.scenes(), clips, audio));

            finished(JobStatus.COMPLETED);
            log.info("Job {} COMPLETED", jobId);

        } catch (StageFailedException e) {
            markFailed(jobId, e.getMessage(), e);
        } catch (RuntimeException e) {
            // A bug rather than a provider failure; still leave the job terminal.
            String prefix = current == null ? "pipeline failed" : current.failurePrefix();
            log.error("Unexpected error in pipeline for job {}", jobId, e);
            markFailed(jobId, prefix + ": " + causeOf(e), e);
        } finally {
            MDC.remove("jobId");
        }
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private ScriptResult runScriptStage(UUID jobId, VideoRequest request) {
        jobStore.update(jobId, job -> {
            job.advanceTo(JobStatus.GENERATING_SCRIPT);
            job.setProgress(SCRIPT_STARTED);
            job.setCurrentStep("Writing engaging script and scene descriptions...");
        });

        ScriptResult result = call(Stage.SCRIPT.failurePrefix(), () ->
                checkScript(scriptExecutor.generateScript(
                        request.topic(), request.duration(), request.style())));

        jobStore.update(jobId, job -> {
            job.recordScript(result.script(), result.scenes());
            job.setProgress(SCRIPT_DONE);
            job.advanceTo(JobStatus.GENERATING_AUDIO);
            job.setCurrentStep("Generating AI voiceover...");
        });
        log.info("Job {} script ready ({} scenes)", jobId, result.scenes().size());
        return result;
    }

    private List<String> runAudioStage(UUID jobId, VideoRequest request, String script) {
        List<String> audio = call(Stage.AUDIO.failurePrefix(), () -> {
            List<String> segments = audioExecutor.generateVoiceover(script, request.voiceId(), jobId);
            if (segments == null || segments.stream().anyMatch(Objects::isNull)) {
                throw new ExecutorException("no audio segments returned");
            }
            return segments;
        });

        jobStore.update(jobId, job -> {
            job.recordAudioSegments(audio);
            job.setProgress(AUDIO_DONE);
            job.advanceTo(JobStatus.GENERATING_VISUALS);
            job.startVideoClips();
            job.setCurrentStep("Generating " + job.getScenes().size() + " video clips...");
        });
        log.info("Job {} voiceover ready ({} segments)", jobId, audio.size());
        return audio;
    }

    /**
     * One provider call per scene, strictly in scene order. Each clip is
     * stored as soon as it exists; the first failing scene ends the stage.
     */
    private List<String> runVisualStage(UUID jobId, VideoRequest request, List<Scene> scenes) {
        int total = scenes.size();
        List<String> clips = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            int    index = i;
            String description = scenes.get(i).description();

            jobStore.update(jobId, job -> job.setCurrentStep(
                    "Generating scene " + (index + 1) + " of " + total + ": " + preview(description)));

            String clip = call(Stage.VISUALS.failurePrefix() + " at scene " + index, () -> {
                String path = visualExecutor.generateSceneClip(description, request.style(), jobId, index);
                if (path == null || path.isBlank()) {
                    throw new ExecutorException("no clip returned");
                }
                return path;
            });

            jobStore.update(jobId, job -> job.addVideoClip(clip));
            clips.add(clip);
            log.debug("Job {} scene {}/{} rendered: {}", jobId, index + 1, total, clip);
        }

        jobStore.update(jobId, job -> {
            job.setProgress(VISUALS_DONE);
            job.advanceTo(JobStatus.PROCESSING_VIDEO);
            job.setCurrentStep("Visuals ready");
        });
        log.info("Job {} visuals ready ({} clips)", jobId, clips.size());
        return List.copyOf(clips);
    }

    private String runMergeStage(UUID jobId, List<Scene> scenes, List<String> clips, List<String> audio) {
        jobStore.update(jobId, job -> {
            job.setProgress(MERGE_STARTED);
            job.setCurrentStep("Merging clips and adding subtitles");
        });

        String finalPath = call(Stage.MERGE.failurePrefix(), () -> {
            String path = mergeExecutor.mergeVideo(scenes, clips, audio, jobId);
            if (path == null || path.isBlank()) {
                throw new ExecutorException("no final video returned");
            }
            return path;
        });

        jobStore.update(jobId, job -> job.complete(finalPath, downloadPath + jobId));
        return finalPath;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Invoke a provider. Any exception becomes a StageFailedException whose
     * message is "<label>: <cause>"; this is the only place provider errors are caught.
     */
    private <T> T call(String failureLabel, Supplier<T> providerCall) {
        try {
            return providerCall.get();
        } catch (Exception e) {
            throw new StageFailedException(failureLabel + ": " + causeOf(e), e);
        }
    }

    /** Time a whole stage, tagging the outcome. */
    private <T> T timed(Stage stage, Supplier<T> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return body.get();
        } catch (RuntimeException e) {
            outcome = "failure";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("viral.stage.duration",
                    "stage", stage.name().toLowerCase(), "outcome", outcome));
        }
    }

    private void markFailed(UUID jobId, String error, Exception cause) {
        log.warn("Job {} FAILED: {}", jobId, error);
        try {
            jobStore.update(jobId, job -> job.fail(error));
            finished(JobStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("Could not record failure for job {} (original error: {})", jobId, error, e);
            e.addSuppressed(cause);
            throw e;
        }
    }

    private void finished(JobStatus status) {
        meterRegistry.counter("viral.jobs.finished", "status", status.name().toLowerCase()).increment();
    }

    private static ScriptResult checkScript(ScriptResult result) {
        if (result == null || result.script() == null || result.scenes() == null) {
            throw new ExecutorException("no script returned");
        }
        for (int i = 0; i < result.scenes().size(); i++) {
            Scene scene = result.scenes().get(i);
            if (scene == null || scene.description() == null || scene.description().isBlank()) {
                throw new ExecutorException("scene " + i + " has no description");
            }
        }
        return result;
    }

    /** Scene description shortened for the progress line; the Job keeps the full text. */
    String preview(String description) {
        if (description.length() <= scenePreviewLength) return description;
        return description.substring(0, scenePreviewLength) + "...";
    }

    private static String causeOf(Throwable e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }

    /** Carries a stage-attributed failure from the stage boundary up to run(). */
    static class StageFailedException extends RuntimeException {
        StageFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
