package com.viralengine.orchestrator.executor;

import java.util.UUID;

/**
 * Renders one video clip per scene.
 */
public interface VisualExecutor {

    /**
     * @param sceneIndex 0-based position of the scene in the script
     * @return reference to the rendered clip
     * @throws ExecutorException on provider failure
     */
    String generateSceneClip(String description, String style, UUID jobId, int sceneIndex);
}
