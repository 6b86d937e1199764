package io.github.drompincen.noject.protocol.api;

import java.time.Instant;

public record ProjectDto(
        String projectId,
        String name,
        String createdBy,
        String color,
        String backgroundColor,
        Integer firstTask,
        Instant createdAt,
        Instant updatedAt
) {}
