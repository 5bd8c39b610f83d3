package com.viralengine.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Output of the script stage: the full narration text and the ordered scene list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScriptResult(String script, List<Scene> scenes) {}
