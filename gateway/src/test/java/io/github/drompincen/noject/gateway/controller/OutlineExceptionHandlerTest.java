package io.github.drompincen.noject.gateway.controller;

import io.github.drompincen.noject.runtime.outline.LevelBoundaryException;
import io.github.drompincen.noject.runtime.outline.OutlineOperation;
import io.github.drompincen.noject.runtime.outline.OutlinePersistenceException;
import io.github.drompincen.noject.runtime.outline.ProjectNotFoundException;
import io.github.drompincen.noject.runtime.outline.TaskNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

import static org.assertj.core.api.Assertions.assertThat;

class OutlineExceptionHandlerTest {

    private final OutlineExceptionHandler handler = new OutlineExceptionHandler();

    @Test
    void missingProjectIs404() {
        ProblemDetail pd = handler.notFound(new ProjectNotFoundException("p1", OutlineOperation.GET_TASKS));

        assertThat(pd.getStatus()).isEqualTo(404);
        assertThat(pd.getDetail()).isEqualTo("Project p1 not found.");
        assertThat(pd.getProperties()).containsEntry("operation", "GET_TASKS").doesNotContainKey("taskId");
    }

    @Test
    void missingTaskIs404WithTaskId() {
        ProblemDetail pd = handler.notFound(new TaskNotFoundException("p1", 7, OutlineOperation.DELETE_TASK));

        assertThat(pd.getStatus()).isEqualTo(404);
        assertThat(pd.getProperties()).containsEntry("taskId", 7).containsEntry("projectId", "p1");
    }

    @Test
    void levelBoundaryIs409() {
        ProblemDetail pd = handler.boundary(
                new LevelBoundaryException("p1", 1, LevelBoundaryException.Boundary.MINIMUM));

        assertThat(pd.getStatus()).isEqualTo(409);
        assertThat(pd.getDetail()).contains("Minimum level reached");
        assertThat(pd.getProperties()).containsEntry("boundary", "MINIMUM")
                .containsEntry("operation", "DECREASE_LEVEL");
    }

    @Test
    void persistenceFailureIs500WithoutInternals() {
        ProblemDetail pd = handler.persistence(new OutlinePersistenceException("p1", 2,
                OutlineOperation.ADD_TASK, new IllegalStateException("connection reset by mongo")));

        assertThat(pd.getStatus()).isEqualTo(500);
        assertThat(pd.getDetail()).doesNotContain("mongo");
    }
}
