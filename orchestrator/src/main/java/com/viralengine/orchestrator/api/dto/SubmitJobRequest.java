package com.viralengine.orchestrator.api.dto;

import com.viralengine.orchestrator.model.VideoRequest;

/**
 * Request body for POST /jobs.
 *
 * Required: topic, voiceId
 * Optional: duration (seconds, default 60), style (default "engaging")
 */
public record SubmitJobRequest(String topic, String voiceId, Integer duration, String style) {

    public VideoRequest toVideoRequest() {
        return new VideoRequest(topic, voiceId, duration, style);
    }
}
