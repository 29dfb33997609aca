package com.stepwright.orchestrator.task;

/**
 * Thrown when a job payload is not a usable task document.
 */
public class InvalidTaskException extends RuntimeException {

    public InvalidTaskException(String message) {
        super(message);
    }

    public InvalidTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
