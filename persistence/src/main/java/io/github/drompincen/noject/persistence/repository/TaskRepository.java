package io.github.drompincen.noject.persistence.repository;

import io.github.drompincen.noject.persistence.document.TaskDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TaskRepository extends MongoRepository<TaskDocument, String> {
    List<TaskDocument> findByProjectId(String projectId);
    Optional<TaskDocument> findByProjectIdAndTaskId(String projectId, int taskId);
    boolean existsByProjectIdAndTaskId(String projectId, int taskId);
    long deleteByProjectId(String projectId);
}
