package com.viralengine.orchestrator.executor;

import com.viralengine.orchestrator.model.Scene;

import java.util.List;
import java.util.UUID;

/**
 * Composites clips, voice-over and subtitles into the final video.
 *
 * scenes and clips correspond by position.
 */
public interface MergeExecutor {

    /**
     * @return path or URL of the final video
     * @throws ExecutorException on provider failure
     */
    String mergeVideo(List<Scene> scenes, List<String> clips, List<String> audioSegments, UUID jobId);
}
