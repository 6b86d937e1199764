package io.github.drompincen.noject.runtime.outline;

public class ProjectNotFoundException extends OutlineException {

    public ProjectNotFoundException(String projectId, OutlineOperation operation) {
        super("Project " + projectId + " not found.", projectId, null, operation, null);
    }
}
