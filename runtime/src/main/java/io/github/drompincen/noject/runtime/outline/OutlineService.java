package io.github.drompincen.noject.runtime.outline;

import io.github.drompincen.noject.persistence.document.ProjectDocument;
import io.github.drompincen.noject.persistence.document.TaskDocument;
import io.github.drompincen.noject.persistence.repository.ProjectRepository;
import io.github.drompincen.noject.persistence.repository.TaskRepository;
import io.github.drompincen.noject.runtime.lock.ProjectLockService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Structural edits of a project's task outline.
 *
 * <p>Every mutation checks that its project (and target task) exist, then takes
 * the project's lock, opens a transaction, reloads and linearizes the outline,
 * applies the change and writes back only the rows it touched together with the
 * project row. The project row carries an optimistic version, so a concurrent
 * commit from another server instance makes this one fail and roll back.
 *
 * <p>Completion rule: a task may only be completed when all of its direct
 * children are. Completing or uncompleting a task forces its whole subtree to
 * the same state and then walks up the ancestors.
 */
@Service
public class OutlineService {

    private static final Logger log = LoggerFactory.getLogger(OutlineService.class);

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final ProjectLockService lockService;
    private final TransactionTemplate transactionTemplate;

    public OutlineService(ProjectRepository projectRepository, TaskRepository taskRepository,
                          ProjectLockService lockService, PlatformTransactionManager transactionManager) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.lockService = lockService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Inserts a new empty task. With {@code prevTaskId} the task becomes the next
     * sibling of that task, placed after its whole subtree; without it the task is
     * appended to the end of the outline at top level.
     */
    public TaskDocument addTask(String projectId, String userId, Integer prevTaskId) {
        OutlineOperation op = OutlineOperation.ADD_TASK;
        requireProject(projectId, op);
        if (prevTaskId != null) {
            requireTask(projectId, prevTaskId, op);
        }
        return mutate(op, projectId, prevTaskId, outline -> {
            TaskDocument task = new TaskDocument(projectId, outline.maxTaskId() + 1);
            task.setCreatedBy(userId);
            task.setCreatedAt(Instant.now());

            if (prevTaskId != null) {
                int prevIndex = outline.require(prevTaskId, op);
                int anchorIndex = OutlineNavigator.lastSubtaskOrSelf(outline.ordered(), prevIndex);
                TaskDocument anchor = outline.get(anchorIndex);
                task.setLevel(outline.get(prevIndex).getLevel());
                task.setNext(anchor.getNext());
                outline.setNext(anchor, task.getTaskId());
                outline.insert(anchorIndex + 1, task);
                uncompleteAncestors(outline, outline.parentIndex(prevIndex));
            } else if (outline.isEmpty()) {
                outline.project().setFirstTask(task.getTaskId());
                outline.insert(0, task);
            } else {
                outline.setNext(outline.get(outline.size() - 1), task.getTaskId());
                outline.insert(outline.size(), task);
            }
            return task;
        });
    }

    public TaskDocument changeValue(String projectId, int taskId, String newValue) {
        OutlineOperation op = OutlineOperation.CHANGE_VALUE;
        requireProject(projectId, op);
        requireTask(projectId, taskId, op);
        return inTransaction(op, projectId, taskId, () -> {
            TaskDocument task = taskRepository.findByProjectIdAndTaskId(projectId, taskId)
                    .orElseThrow(() -> new TaskNotFoundException(projectId, taskId, op));
            task.setValue(newValue != null ? newValue : "");
            task.setLastModifiedAt(Instant.now());
            return taskRepository.save(task);
        });
    }

    /**
     * Removes a task. Its descendants move up one level to take its place and
     * the chain is relinked around it.
     */
    public void deleteTask(String projectId, int taskId) {
        OutlineOperation op = OutlineOperation.DELETE_TASK;
        requireProject(projectId, op);
        requireTask(projectId, taskId, op);
        mutate(op, projectId, taskId, outline -> {
            int index = outline.require(taskId, op);
            TaskDocument target = outline.get(index);
            int end = outline.subtreeEnd(index);
            for (int i = index + 1; i < end; i++) {
                TaskDocument descendant = outline.get(i);
                outline.setLevel(descendant, descendant.getLevel() - 1);
            }

            ProjectDocument project = outline.project();
            if (Objects.equals(project.getFirstTask(), taskId)) {
                project.setFirstTask(target.getNext());
            } else if (index > 0) {
                outline.setNext(outline.get(index - 1), target.getNext());
            }
            outline.remove(index);
            taskRepository.delete(target);
            return null;
        });
    }

    public void increaseLevel(String projectId, int taskId) {
        increaseLevel(projectId, taskId, null);
    }

    /**
     * Indents a task under its predecessor. Only the task itself moves; its
     * former children stay where they are. Ancestors completed as a result
     * record {@code userId} as their completer.
     */
    public void increaseLevel(String projectId, int taskId, String userId) {
        OutlineOperation op = OutlineOperation.INCREASE_LEVEL;
        requireProject(projectId, op);
        requireTask(projectId, taskId, op);
        mutate(op, projectId, taskId, outline -> {
            int index = outline.require(taskId, op);
            TaskDocument target = outline.get(index);
            if (index == 0 || outline.get(index - 1).getLevel() < target.getLevel()) {
                throw new LevelBoundaryException(projectId, taskId, LevelBoundaryException.Boundary.MAXIMUM);
            }
            outline.setLevel(target, target.getLevel() + 1);

            int parentIndex = outline.parentIndex(index);
            if (parentIndex != OutlineNavigator.NO_PARENT) {
                TaskDocument parent = outline.get(parentIndex);
                if (!target.isCompleted() && parent.isCompleted()) {
                    uncompleteAncestors(outline, parentIndex);
                } else if (target.isCompleted() && !parent.isCompleted()) {
                    completeAncestors(outline, parentIndex, userId);
                }
            }
            return null;
        });
    }

    public void decreaseLevel(String projectId, int taskId) {
        decreaseLevel(projectId, taskId, null);
    }

    /**
     * Outdents a task together with its subtree. Later siblings of the task
     * become its children, so a completed task that picks up an incomplete
     * child is uncompleted along with its ancestors. The former parent is
     * marked completed (by {@code userId}) if every child it still has is
     * completed; ancestors further up are not re-checked.
     */
    public void decreaseLevel(String projectId, int taskId, String userId) {
        OutlineOperation op = OutlineOperation.DECREASE_LEVEL;
        requireProject(projectId, op);
        requireTask(projectId, taskId, op);
        mutate(op, projectId, taskId, outline -> {
            int index = outline.require(taskId, op);
            TaskDocument target = outline.get(index);
            if (target.getLevel() == 0) {
                throw new LevelBoundaryException(projectId, taskId, LevelBoundaryException.Boundary.MINIMUM);
            }
            int oldParentIndex = outline.parentIndex(index);
            int end = outline.subtreeEnd(index);
            for (int i = index; i < end; i++) {
                TaskDocument task = outline.get(i);
                outline.setLevel(task, task.getLevel() - 1);
            }

            if (target.isCompleted()
                    && !outline.children(index).stream().allMatch(TaskDocument::isCompleted)) {
                outline.setCompleted(target, false, null);
                uncompleteAncestors(outline, outline.parentIndex(index));
            }
            if (oldParentIndex != OutlineNavigator.NO_PARENT) {
                List<TaskDocument> remaining = outline.children(oldParentIndex);
                if (!remaining.isEmpty() && remaining.stream().allMatch(TaskDocument::isCompleted)) {
                    outline.setCompleted(outline.get(oldParentIndex), true, userId);
                }
            }
            return null;
        });
    }

    public void completeTask(String projectId, int taskId) {
        completeTask(projectId, taskId, null);
    }

    /**
     * Completes a task and its whole subtree, then completes each ancestor whose
     * direct children are now all completed, stopping at the first that is not.
     * Tasks switched to completed record {@code userId} as their completer.
     */
    public void completeTask(String projectId, int taskId, String userId) {
        OutlineOperation op = OutlineOperation.COMPLETE_TASK;
        requireProject(projectId, op);
        requireTask(projectId, taskId, op);
        mutate(op, projectId, taskId, outline -> {
            int index = outline.require(taskId, op);
            int end = outline.subtreeEnd(index);
            for (int i = index; i < end; i++) {
                outline.setCompleted(outline.get(i), true, userId);
            }
            completeAncestors(outline, outline.parentIndex(index), userId);
            return null;
        });
    }

    /**
     * Uncompletes a task and its whole subtree, then uncompletes ancestors up to
     * the first one that is already incomplete.
     */
    public void uncompleteTask(String projectId, int taskId) {
        OutlineOperation op = OutlineOperation.UNCOMPLETE_TASK;
        requireProject(projectId, op);
        requireTask(projectId, taskId, op);
        mutate(op, projectId, taskId, outline -> {
            int index = outline.require(taskId, op);
            int end = outline.subtreeEnd(index);
            for (int i = index; i < end; i++) {
                outline.setCompleted(outline.get(i), false, null);
            }
            uncompleteAncestors(outline, outline.parentIndex(index));
            return null;
        });
    }

    /** Outline order, read without the project lock; may trail an in-flight mutation. */
    public List<TaskDocument> getOrderedTasks(String projectId) {
        OutlineOperation op = OutlineOperation.GET_TASKS;
        return read(op, projectId, null, () -> {
            ProjectDocument project = projectRepository.findById(projectId)
                    .orElseThrow(() -> new ProjectNotFoundException(projectId, op));
            return OutlineLinearizer.linearize(taskRepository.findByProjectId(projectId), project.getFirstTask());
        });
    }

    // ---- Completion cascade ----

    private void completeAncestors(OutlineSnapshot outline, int parentIndex, String userId) {
        while (parentIndex != OutlineNavigator.NO_PARENT) {
            if (!outline.allChildrenCompleted(parentIndex)) {
                break;
            }
            outline.setCompleted(outline.get(parentIndex), true, userId);
            parentIndex = outline.parentIndex(parentIndex);
        }
    }

    private void uncompleteAncestors(OutlineSnapshot outline, int parentIndex) {
        while (parentIndex != OutlineNavigator.NO_PARENT) {
            TaskDocument parent = outline.get(parentIndex);
            if (!parent.isCompleted()) {
                break;
            }
            outline.setCompleted(parent, false, null);
            parentIndex = outline.parentIndex(parentIndex);
        }
    }

    // ---- Locking and transactions ----

    private <T> T mutate(OutlineOperation op, String projectId, Integer taskId,
                         Function<OutlineSnapshot, T> mutation) {
        return inTransaction(op, projectId, taskId, () -> {
            OutlineSnapshot outline = load(projectId, op);
            T result = mutation.apply(outline);
            if (!outline.dirtyTasks().isEmpty()) {
                taskRepository.saveAll(new ArrayList<>(outline.dirtyTasks()));
            }
            ProjectDocument project = outline.project();
            project.setUpdatedAt(Instant.now());
            projectRepository.save(project);
            log.debug("{} on project {} task {} touched {} tasks", op, projectId, taskId, outline.dirtyTasks().size());
            return result;
        });
    }

    private <T> T inTransaction(OutlineOperation op, String projectId, Integer taskId, Supplier<T> work) {
        try {
            return lockService.withLock(projectId, () -> transactionTemplate.execute(status -> work.get()));
        } catch (OutlineException e) {
            log.warn("{} rejected for project {}: {}", op, projectId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed for project {} task {}, rolled back", op, projectId, taskId, e);
            throw new OutlinePersistenceException(projectId, taskId, op, e);
        }
    }

    /** Unlocked read with the same error translation as a mutation, minus the transaction. */
    private <T> T read(OutlineOperation op, String projectId, Integer taskId, Supplier<T> query) {
        try {
            return query.get();
        } catch (OutlineException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} read failed for project {} task {}", op, projectId, taskId, e);
            throw new OutlinePersistenceException(projectId, taskId, op, e);
        }
    }

    private OutlineSnapshot load(String projectId, OutlineOperation op) {
        ProjectDocument project = projectRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId, op));
        List<TaskDocument> tasks = taskRepository.findByProjectId(projectId);
        int maxTaskId = tasks.stream().mapToInt(TaskDocument::getTaskId).max().orElse(0);
        return new OutlineSnapshot(project, OutlineLinearizer.linearize(tasks, project.getFirstTask()), maxTaskId);
    }

    private void requireProject(String projectId, OutlineOperation op) {
        if (projectId == null || !read(op, projectId, null, () -> projectRepository.existsById(projectId))) {
            throw new ProjectNotFoundException(projectId, op);
        }
    }

    private void requireTask(String projectId, int taskId, OutlineOperation op) {
        if (!read(op, projectId, taskId, () -> taskRepository.existsByProjectIdAndTaskId(projectId, taskId))) {
            throw new TaskNotFoundException(projectId, taskId, op);
        }
    }
}
