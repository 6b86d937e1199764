package io.github.drompincen.noject.persistence.repository;

import io.github.drompincen.noject.persistence.document.ProjectDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProjectRepository extends MongoRepository<ProjectDocument, String> {
    List<ProjectDocument> findAllByOrderByUpdatedAtDesc();
    List<ProjectDocument> findByCreatedByOrderByUpdatedAtDesc(String createdBy);
}
