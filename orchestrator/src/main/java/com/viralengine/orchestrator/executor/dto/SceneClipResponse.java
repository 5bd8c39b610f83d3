package com.viralengine.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response of POST /scene-clip. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SceneClipResponse(String video_path) {}
