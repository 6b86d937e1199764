package io.github.drompincen.noject.runtime.outline;

public class TaskNotFoundException extends OutlineException {

    public TaskNotFoundException(String projectId, int taskId, OutlineOperation operation) {
        super("Task ID " + taskId + " of project " + projectId + " not found.", projectId, taskId, operation, null);
    }
}
