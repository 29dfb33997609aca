package com.stepwright.orchestrator.service;

/** Bad input to a queue or control operation (maps to HTTP 400). */
public class QueueValidationException extends RuntimeException {

    public QueueValidationException(String message) {
        super(message);
    }
}
