package io.github.drompincen.noject.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.drompincen.noject.protocol.api.TaskDto;

import java.time.Instant;

/**
 * Committed outline change, fanned out to the other collaborators of a project.
 * {@code task} is only set for {@link OutlineEventType#ADDED_TASK},
 * {@code newValue} only for {@link OutlineEventType#CHANGED_VALUE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutlineEvent(
        OutlineEventType type,
        String projectId,
        int taskId,
        TaskDto task,
        String newValue,
        Instant timestamp
) {
    public static OutlineEvent addedTask(String projectId, TaskDto task) {
        return new OutlineEvent(OutlineEventType.ADDED_TASK, projectId, task.id(), task, null, Instant.now());
    }

    public static OutlineEvent changedValue(String projectId, int taskId, String newValue) {
        return new OutlineEvent(OutlineEventType.CHANGED_VALUE, projectId, taskId, null, newValue, Instant.now());
    }

    public static OutlineEvent of(OutlineEventType type, String projectId, int taskId) {
        return new OutlineEvent(type, projectId, taskId, null, null, Instant.now());
    }
}
