package io.github.drompincen.noject.gateway.mapping;

import io.github.drompincen.noject.persistence.document.ProjectDocument;
import io.github.drompincen.noject.persistence.document.TaskDocument;
import io.github.drompincen.noject.protocol.api.ProjectDto;
import io.github.drompincen.noject.protocol.api.TaskDto;

import java.util.List;
import java.util.stream.Collectors;

public final class OutlineMapper {

    private OutlineMapper() {}

    public static TaskDto toDto(TaskDocument doc) {
        return new TaskDto(doc.getTaskId(), doc.getLevel(), doc.getValue(), doc.getNext(),
                doc.isCompleted(), doc.getCreatedBy(), doc.getCompletedBy(),
                doc.getCreatedAt(), doc.getLastModifiedAt());
    }

    public static List<TaskDto> toDtos(List<TaskDocument> docs) {
        return docs.stream().map(OutlineMapper::toDto).collect(Collectors.toList());
    }

    public static ProjectDto toDto(ProjectDocument doc) {
        return new ProjectDto(doc.getProjectId(), doc.getName(), doc.getCreatedBy(),
                doc.getColor(), doc.getBackgroundColor(), doc.getFirstTask(),
                doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
