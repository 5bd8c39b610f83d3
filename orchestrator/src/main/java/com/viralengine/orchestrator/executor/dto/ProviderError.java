package com.viralengine.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error body the provider gateway sends with non-2xx responses.
 * Only {@code detail} is used; it becomes the stage failure cause.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderError(String detail) {}
