package io.github.drompincen.noject.runtime.outline;

/**
 * Unexpected failure while reading or writing outline rows. The transaction
 * has been rolled back and the project lock released by the time this is thrown.
 */
public class OutlinePersistenceException extends OutlineException {

    public OutlinePersistenceException(String projectId, Integer taskId, OutlineOperation operation, Throwable cause) {
        super(message(projectId, taskId, operation), projectId, taskId, operation, cause);
    }

    private static String message(String projectId, Integer taskId, OutlineOperation operation) {
        String target = taskId != null ? " (task " + taskId + ")" : "";
        return "Error " + operation.description() + " Project " + projectId + target;
    }
}
