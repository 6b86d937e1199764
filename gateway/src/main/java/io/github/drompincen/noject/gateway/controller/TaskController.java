package io.github.drompincen.noject.gateway.controller;

import io.github.drompincen.noject.gateway.mapping.OutlineMapper;
import io.github.drompincen.noject.persistence.document.TaskDocument;
import io.github.drompincen.noject.protocol.api.AddTaskRequest;
import io.github.drompincen.noject.protocol.api.ChangeValueRequest;
import io.github.drompincen.noject.protocol.api.TaskDto;
import io.github.drompincen.noject.protocol.event.OutlineEvent;
import io.github.drompincen.noject.protocol.event.OutlineEventType;
import io.github.drompincen.noject.runtime.outline.OutlineBroadcaster;
import io.github.drompincen.noject.runtime.outline.OutlineService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Outline edits over HTTP. Every successful change is also pushed to all
 * WebSocket subscribers of the project; failures are mapped by
 * {@link OutlineExceptionHandler}.
 */
@RestController
@RequestMapping("/api/projects/{projectId}/tasks")
public class TaskController {

    private final OutlineService outlineService;
    private final OutlineBroadcaster broadcaster;

    public TaskController(OutlineService outlineService, OutlineBroadcaster broadcaster) {
        this.outlineService = outlineService;
        this.broadcaster = broadcaster;
    }

    @GetMapping
    public Map<String, List<TaskDto>> list(@PathVariable String projectId) {
        return Map.of("tasks", OutlineMapper.toDtos(outlineService.getOrderedTasks(projectId)));
    }

    @PostMapping
    public ResponseEntity<TaskDto> add(@PathVariable String projectId,
                                       @RequestBody(required = false) AddTaskRequest req) {
        String userId = req != null ? req.userId() : null;
        Integer prevTaskId = req != null ? req.prevTaskId() : null;
        TaskDto dto = OutlineMapper.toDto(outlineService.addTask(projectId, userId, prevTaskId));
        broadcaster.broadcast(OutlineEvent.addedTask(projectId, dto), null);
        return ResponseEntity.ok(dto);
    }

    @PutMapping("/{taskId}/value")
    public ResponseEntity<TaskDto> changeValue(@PathVariable String projectId, @PathVariable int taskId,
                                               @RequestBody ChangeValueRequest req) {
        TaskDocument doc = outlineService.changeValue(projectId, taskId, req.value());
        broadcaster.broadcast(OutlineEvent.changedValue(projectId, taskId, doc.getValue()), null);
        return ResponseEntity.ok(OutlineMapper.toDto(doc));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(@PathVariable String projectId, @PathVariable int taskId) {
        outlineService.deleteTask(projectId, taskId);
        return changed(OutlineEventType.DELETED_TASK, projectId, taskId);
    }

    @PostMapping("/{taskId}/indent")
    public ResponseEntity<Void> indent(@PathVariable String projectId, @PathVariable int taskId,
                                       @RequestParam(required = false) String userId) {
        outlineService.increaseLevel(projectId, taskId, userId);
        return changed(OutlineEventType.INCREASED_LEVEL, projectId, taskId);
    }

    @PostMapping("/{taskId}/outdent")
    public ResponseEntity<Void> outdent(@PathVariable String projectId, @PathVariable int taskId,
                                        @RequestParam(required = false) String userId) {
        outlineService.decreaseLevel(projectId, taskId, userId);
        return changed(OutlineEventType.DECREASED_LEVEL, projectId, taskId);
    }

    @PostMapping("/{taskId}/complete")
    public ResponseEntity<Void> complete(@PathVariable String projectId, @PathVariable int taskId,
                                         @RequestParam(required = false) String userId) {
        outlineService.completeTask(projectId, taskId, userId);
        return changed(OutlineEventType.COMPLETED_TASK, projectId, taskId);
    }

    @PostMapping("/{taskId}/uncomplete")
    public ResponseEntity<Void> uncomplete(@PathVariable String projectId, @PathVariable int taskId) {
        outlineService.uncompleteTask(projectId, taskId);
        return changed(OutlineEventType.UNCOMPLETED_TASK, projectId, taskId);
    }

    private ResponseEntity<Void> changed(OutlineEventType type, String projectId, int taskId) {
        broadcaster.broadcast(OutlineEvent.of(type, projectId, taskId), null);
        return ResponseEntity.noContent().build();
    }
}
