package io.github.drompincen.noject.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "projects")
public class ProjectDocument {

    @Id
    private String projectId;
    private String name;
    @Indexed
    private String createdBy;
    private String color;
    private String backgroundColor;
    // Head of the task chain; null when the outline is empty.
    private Integer firstTask;
    @Version
    private Long version;
    private Instant createdAt;
    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant updatedAt;

    public ProjectDocument() {}

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public String getBackgroundColor() { return backgroundColor; }
    public void setBackgroundColor(String backgroundColor) { this.backgroundColor = backgroundColor; }

    public Integer getFirstTask() { return firstTask; }
    public void setFirstTask(Integer firstTask) { this.firstTask = firstTask; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
