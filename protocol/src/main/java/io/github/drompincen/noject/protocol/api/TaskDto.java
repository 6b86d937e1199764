package io.github.drompincen.noject.protocol.api;

import java.time.Instant;

/**
 * One row of a project outline. {@code next} is the id of the following task
 * in outline order, or {@code null} for the tail.
 */
public record TaskDto(
        int id,
        int level,
        String value,
        Integer next,
        boolean completed,
        String createdBy,
        String completedBy,
        Instant createdAt,
        Instant lastModifiedAt
) {}
