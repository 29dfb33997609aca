package com.stepwright.orchestrator.model;

public enum EventLevel {
    INFO,
    WARN,
    ERROR
}
