package io.github.drompincen.noject.runtime.outline;

/**
 * Thrown when indenting a task that has no possible new parent, or outdenting
 * a top-level task. Raised before any row is touched.
 */
public class LevelBoundaryException extends OutlineException {

    public enum Boundary { MAXIMUM, MINIMUM }

    private final Boundary boundary;

    public LevelBoundaryException(String projectId, int taskId, Boundary boundary) {
        super((boundary == Boundary.MAXIMUM ? "Maximum" : "Minimum")
                        + " level reached for Task " + taskId + " of Project " + projectId,
                projectId, taskId,
                boundary == Boundary.MAXIMUM ? OutlineOperation.INCREASE_LEVEL : OutlineOperation.DECREASE_LEVEL,
                null);
        this.boundary = boundary;
    }

    public Boundary getBoundary() {
        return boundary;
    }
}
