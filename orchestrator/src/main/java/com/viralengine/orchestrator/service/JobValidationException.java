package com.viralengine.orchestrator.service;

import java.util.List;

/**
 * Thrown by {@link JobDispatcher#submit} when a request is malformed.
 * No Job exists for a rejected request.
 */
public class JobValidationException extends RuntimeException {

    private final List<String> violations;

    public JobValidationException(List<String> violations) {
        super("Invalid video request: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() { return violations; }
}
