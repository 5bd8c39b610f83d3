package com.viralengine.orchestrator.executor;

import com.viralengine.orchestrator.executor.dto.MergeResponse;
import com.viralengine.orchestrator.executor.dto.ProviderError;
import com.viralengine.orchestrator.executor.dto.SceneClipResponse;
import com.viralengine.orchestrator.executor.dto.VoiceoverResponse;
import com.viralengine.orchestrator.model.Scene;
import com.viralengine.orchestrator.model.ScriptResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the generation provider gateway.
 *
 * The gateway fronts the script LLM, the voice synthesizer and the
 * video renderer/compositor; this class exposes each of its endpoints
 * as one of the four executor interfaces:
 *
 *   POST /script      → {@link ScriptExecutor}
 *   POST /voiceover   → {@link AudioExecutor}
 *   POST /scene-clip  → {@link VisualExecutor}
 *   POST /merge       → {@link MergeExecutor}
 *
 * Calls block; they are made from the pipeline worker pool, never
 * from a request thread.
 */
@Component
public class ProviderClient implements ScriptExecutor, AudioExecutor, VisualExecutor, MergeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProviderClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public ProviderClient(
            @Value("${viral.provider.base-url}") String baseUrl,
            @Value("${viral.provider.timeout-seconds:300}") long timeoutSeconds,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Executor endpoints
    // ------------------------------------------------------------------

    @Override
    public ScriptResult generateScript(String topic, int duration, String style) {
        log.info("Requesting script for topic '{}' ({} s, style={})", topic, duration, style);
        String body = toJson(Map.of("topic",    topic,
                                    "duration", duration,
                                    "style",    style));
        ScriptResult result = parse(post("/script", body), ScriptResult.class, "script");
        if (result.script() == null || result.scenes() == null) {
            throw new ExecutorException("script response is missing script or scenes");
        }
        return result;
    }

    @Override
    public List<String> generateVoiceover(String script, String voiceId, UUID jobId) {
        log.info("Requesting voiceover for job {} with voice '{}'", jobId, voiceId);
        String body = toJson(Map.of("script",     script,
                                    "voice_id",   voiceId,
                                    "project_id", jobId.toString()));
        VoiceoverResponse resp = parse(post("/voiceover", body), VoiceoverResponse.class, "voiceover");
        if (resp.audio_files() == null) {
            throw new ExecutorException("voiceover response has no audio_files");
        }
        return resp.audio_files();
    }

    @Override
    public String generateSceneClip(String description, String style, UUID jobId, int sceneIndex) {
        log.debug("Requesting clip for scene {} of job {}", sceneIndex, jobId);
        String body = toJson(Map.of("description", description,
                                    "style",       style,
                                    "project_id",  jobId.toString(),
                                    "scene_index", sceneIndex));
        SceneClipResponse resp = parse(post("/scene-clip", body), SceneClipResponse.class, "scene-clip");
        if (resp.video_path() == null || resp.video_path().isBlank()) {
            throw new ExecutorException("scene-clip response has no video_path");
        }
        return resp.video_path();
    }

    @Override
    public String mergeVideo(List<Scene> scenes, List<String> clips, List<String> audioSegments, UUID jobId) {
        log.info("Requesting merge of {} clips for job {}", clips.size(), jobId);
        String body = toJson(Map.of("scenes",      scenes,
                                    "video_clips", clips,
                                    "audio_files", audioSegments,
                                    "project_id",  jobId.toString()));
        MergeResponse resp = parse(post("/merge", body), MergeResponse.class, "merge");
        if (resp.final_video_path() == null || resp.final_video_path().isBlank()) {
            throw new ExecutorException("merge response has no final_video_path");
        }
        return resp.final_video_path();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST a JSON body; returns the response body, or throws with the gateway's error detail. */
    private String post(String path, String jsonBody) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(errorDetail(resp.statusCode(), resp.body()));
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(path + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(path + " unreachable: " + e.getMessage(), e);
        }
    }

    /** Prefer the gateway's {"detail": "..."} message; fall back to status and raw body. */
    private String errorDetail(int status, String body) {
        try {
            ProviderError err = json.readValue(body, ProviderError.class);
            if (err != null && err.detail() != null && !err.detail().isBlank()) {
                return err.detail();
            }
        } catch (JsonProcessingException e) {
            log.debug("Provider error body is not JSON: {}", e.getOriginalMessage());
        }
        return "HTTP " + status + ": " + body;
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
