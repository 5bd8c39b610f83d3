package com.viralengine.orchestrator.api.dto;

import java.util.List;

/** Body returned with 400 responses. */
public record ErrorResponse(String error, List<String> violations) {}
