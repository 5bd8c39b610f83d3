package com.viralengine.orchestrator.executor;

import java.util.List;
import java.util.UUID;

/**
 * Synthesizes the voice-over for a script.
 */
public interface AudioExecutor {

    /**
     * @return audio segment references, in playback order
     * @throws ExecutorException on provider failure
     */
    List<String> generateVoiceover(String script, String voiceId, UUID jobId);
}
