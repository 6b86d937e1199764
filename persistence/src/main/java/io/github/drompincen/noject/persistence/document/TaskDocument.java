package io.github.drompincen.noject.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A task row. Task ids are only unique within their project, so the document
 * key combines both (see {@link #key(String, int)}).
 */
@Document(collection = "tasks")
@CompoundIndex(name = "project_task", def = "{'projectId': 1, 'taskId': 1}", unique = true)
public class TaskDocument {

    @Id
    private String id;
    private String projectId;
    private int taskId;
    private int level;
    private String value = "";
    private Integer next;
    private boolean completed;
    private String createdBy;
    private String completedBy;
    private Instant createdAt;
    private Instant lastModifiedAt;

    public TaskDocument() {}

    public TaskDocument(String projectId, int taskId) {
        this.id = key(projectId, taskId);
        this.projectId = projectId;
        this.taskId = taskId;
    }

    public static String key(String projectId, int taskId) {
        return projectId + ":" + taskId;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public int getTaskId() { return taskId; }
    public void setTaskId(int taskId) { this.taskId = taskId; }

    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = level; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public Integer getNext() { return next; }
    public void setNext(Integer next) { this.next = next; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public String getCompletedBy() { return completedBy; }
    public void setCompletedBy(String completedBy) { this.completedBy = completedBy; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastModifiedAt() { return lastModifiedAt; }
    public void setLastModifiedAt(Instant lastModifiedAt) { this.lastModifiedAt = lastModifiedAt; }

    @Override
    public String toString() {
        return "Task[" + taskId + " level=" + level + " next=" + next + (completed ? " done" : "") + "]";
    }
}
