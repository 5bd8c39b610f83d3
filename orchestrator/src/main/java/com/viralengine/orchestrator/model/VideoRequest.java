package com.viralengine.orchestrator.model;

/**
 * Immutable copy of a video generation request, captured when the Job is created.
 *
 * duration is in seconds. Omitted duration and style fall back to
 * the same defaults the public API documents (60 s, "engaging").
 */
public record VideoRequest(String topic, String voiceId, Integer duration, String style) {

    public static final int    DEFAULT_DURATION = 60;
    public static final String DEFAULT_STYLE    = "engaging";

    // Compact constructor: fill in defaults for optional fields.
    public VideoRequest {
        if (duration == null)                 duration = DEFAULT_DURATION;
        if (style == null || style.isBlank()) style    = DEFAULT_STYLE;
    }
}
