package com.viralengine.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response of POST /merge. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MergeResponse(String final_video_path) {}
