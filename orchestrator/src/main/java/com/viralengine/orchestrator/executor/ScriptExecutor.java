package com.viralengine.orchestrator.executor;

import com.viralengine.orchestrator.model.ScriptResult;

/**
 * Writes the narration script and splits it into scenes.
 */
public interface ScriptExecutor {

    /**
     * @param duration target video length in seconds
     * @throws ExecutorException on provider failure
     */
    ScriptResult generateScript(String topic, int duration, String style);
}
