package com.stepwright.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.stepwright.orchestrator.model.JobEvent;

import java.time.Instant;
import java.util.Locale;

public record EventResponse(
        Long                id,
        String              level,
        String              event,
        @JsonRawValue String payload,
        Instant             createdAt
) {
    public static EventResponse from(JobEvent e) {
        return new EventResponse(e.getId(), e.getLevel().name().toLowerCase(Locale.ROOT), e.getEvent(),
                e.getPayload(), e.getCreatedAt());
    }
}
