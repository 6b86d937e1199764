package io.github.drompincen.noject.gateway.controller;

import io.github.drompincen.noject.runtime.outline.LevelBoundaryException;
import io.github.drompincen.noject.runtime.outline.OutlineException;
import io.github.drompincen.noject.runtime.outline.OutlinePersistenceException;
import io.github.drompincen.noject.runtime.outline.ProjectNotFoundException;
import io.github.drompincen.noject.runtime.outline.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class OutlineExceptionHandler {

    @ExceptionHandler({ProjectNotFoundException.class, TaskNotFoundException.class})
    public ProblemDetail notFound(OutlineException e) {
        return problem(HttpStatus.NOT_FOUND, e.getMessage(), e);
    }

    @ExceptionHandler(LevelBoundaryException.class)
    public ProblemDetail boundary(LevelBoundaryException e) {
        ProblemDetail pd = problem(HttpStatus.CONFLICT, e.getMessage(), e);
        pd.setProperty("boundary", e.getBoundary().name());
        return pd;
    }

    // Details of the storage failure stay in the server log.
    @ExceptionHandler(OutlinePersistenceException.class)
    public ProblemDetail persistence(OutlinePersistenceException e) {
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "The outline change could not be saved", e);
    }

    private static ProblemDetail problem(HttpStatus status, String detail, OutlineException e) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setProperty("projectId", e.getProjectId());
        if (e.getTaskId() != null) {
            pd.setProperty("taskId", e.getTaskId());
        }
        pd.setProperty("operation", e.getOperation().name());
        return pd;
    }
}
