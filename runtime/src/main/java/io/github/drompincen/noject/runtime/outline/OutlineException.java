package io.github.drompincen.noject.runtime.outline;

/**
 * Base of all failures raised by {@link OutlineService}. Carries the project,
 * the task (when the operation targets one) and the operation that failed.
 */
public abstract class OutlineException extends RuntimeException {

    private final String projectId;
    private final Integer taskId;
    private final OutlineOperation operation;

    protected OutlineException(String message, String projectId, Integer taskId,
                               OutlineOperation operation, Throwable cause) {
        super(message, cause);
        this.projectId = projectId;
        this.taskId = taskId;
        this.operation = operation;
    }

    public String getProjectId() {
        return projectId;
    }

    public Integer getTaskId() {
        return taskId;
    }

    public OutlineOperation getOperation() {
        return operation;
    }
}
