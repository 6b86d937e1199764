package io.github.drompincen.noject.runtime.outline;

import io.github.drompincen.noject.persistence.document.ProjectDocument;
import io.github.drompincen.noject.persistence.document.TaskDocument;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * The linearized outline of one project as loaded inside a mutation's
 * transaction, plus the rows the mutation has changed so far.
 */
final class OutlineSnapshot {

    private final ProjectDocument project;
    private final List<TaskDocument> ordered;
    private final int maxTaskId;
    private final Set<TaskDocument> dirty = Collections.newSetFromMap(new IdentityHashMap<>());

    OutlineSnapshot(ProjectDocument project, List<TaskDocument> ordered, int maxTaskId) {
        this.project = project;
        this.ordered = ordered;
        this.maxTaskId = maxTaskId;
    }

    ProjectDocument project() {
        return project;
    }

    String projectId() {
        return project.getProjectId();
    }

    List<TaskDocument> ordered() {
        return ordered;
    }

    int maxTaskId() {
        return maxTaskId;
    }

    int size() {
        return ordered.size();
    }

    boolean isEmpty() {
        return ordered.isEmpty();
    }

    TaskDocument get(int index) {
        return ordered.get(index);
    }

    int require(int taskId, OutlineOperation operation) {
        int index = OutlineNavigator.indexOf(ordered, taskId);
        if (index < 0) {
            throw new TaskNotFoundException(projectId(), taskId, operation);
        }
        return index;
    }

    int parentIndex(int index) {
        return OutlineNavigator.parentIndex(ordered, index);
    }

    List<TaskDocument> children(int parentIndex) {
        return OutlineNavigator.children(ordered, parentIndex);
    }

    int subtreeEnd(int index) {
        return OutlineNavigator.subtreeEnd(ordered, index);
    }

    boolean allChildrenCompleted(int parentIndex) {
        return children(parentIndex).stream().allMatch(TaskDocument::isCompleted);
    }

    void insert(int index, TaskDocument task) {
        ordered.add(index, task);
        dirty.add(task);
    }

    TaskDocument remove(int index) {
        TaskDocument removed = ordered.remove(index);
        dirty.remove(removed);
        return removed;
    }

    void setLevel(TaskDocument task, int level) {
        task.setLevel(level);
        dirty.add(task);
    }

    void setNext(TaskDocument task, Integer next) {
        task.setNext(next);
        dirty.add(task);
    }

    /** No-op when the task is already in the requested state, so completedBy is kept. */
    void setCompleted(TaskDocument task, boolean completed, String userId) {
        if (task.isCompleted() == completed) {
            return;
        }
        task.setCompleted(completed);
        task.setCompletedBy(completed ? userId : null);
        dirty.add(task);
    }

    Collection<TaskDocument> dirtyTasks() {
        return dirty;
    }
}
