package com.viralengine.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Response of POST /voiceover. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VoiceoverResponse(List<String> audio_files) {}
