package com.viralengine.orchestrator.executor;

/**
 * Thrown when a generation provider returns an error, is unreachable,
 * or answers with something the pipeline cannot use.
 *
 * The message is what ends up after the stage prefix in the job's error,
 * so keep it short and provider-facing ("quota exceeded", "HTTP 503: ...").
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
