package io.github.drompincen.noject.gateway.controller;

import io.github.drompincen.noject.persistence.document.TaskDocument;
import io.github.drompincen.noject.protocol.api.AddTaskRequest;
import io.github.drompincen.noject.protocol.api.ChangeValueRequest;
import io.github.drompincen.noject.protocol.api.TaskDto;
import io.github.drompincen.noject.protocol.event.OutlineEvent;
import io.github.drompincen.noject.protocol.event.OutlineEventType;
import io.github.drompincen.noject.runtime.outline.OutlineBroadcaster;
import io.github.drompincen.noject.runtime.outline.OutlineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TaskControllerTest {

    @Mock private OutlineService outlineService;
    @Mock private OutlineBroadcaster broadcaster;

    private TaskController controller;

    @BeforeEach
    void setUp() {
        controller = new TaskController(outlineService, broadcaster);
    }

    private static TaskDocument makeTask(int id, int level, Integer next) {
        TaskDocument t = new TaskDocument("p1", id);
        t.setLevel(level);
        t.setNext(next);
        t.setValue("task " + id);
        t.setCreatedBy("u1");
        t.setCreatedAt(Instant.now());
        return t;
    }

    private OutlineEvent broadcastEvent() {
        ArgumentCaptor<OutlineEvent> captor = ArgumentCaptor.forClass(OutlineEvent.class);
        verify(broadcaster).broadcast(captor.capture(), isNull());
        return captor.getValue();
    }

    @Test
    void listWrapsOrderedTasks() {
        when(outlineService.getOrderedTasks("p1")).thenReturn(List.of(makeTask(2, 0, 1), makeTask(1, 1, null)));

        Map<String, List<TaskDto>> body = controller.list("p1");

        assertThat(body.get("tasks")).extracting(TaskDto::id).containsExactly(2, 1);
        assertThat(body.get("tasks").get(1).level()).isEqualTo(1);
        verifyNoInteractions(broadcaster);
    }

    @Test
    void addReturnsTaskAndBroadcastsToEveryone() {
        when(outlineService.addTask("p1", "u1", 3)).thenReturn(makeTask(4, 1, null));

        ResponseEntity<TaskDto> response = controller.add("p1", new AddTaskRequest("u1", 3));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().id()).isEqualTo(4);
        assertThat(response.getBody().createdBy()).isEqualTo("u1");
        OutlineEvent event = broadcastEvent();
        assertThat(event.type()).isEqualTo(OutlineEventType.ADDED_TASK);
        assertThat(event.task().id()).isEqualTo(4);
    }

    @Test
    void addWithoutBodyAppends() {
        when(outlineService.addTask("p1", null, null)).thenReturn(makeTask(1, 0, null));

        ResponseEntity<TaskDto> response = controller.add("p1", null);

        assertThat(response.getBody().id()).isEqualTo(1);
        verify(outlineService).addTask("p1", null, null);
    }

    @Test
    void changeValueBroadcastsStoredValue() {
        TaskDocument updated = makeTask(2, 0, null);
        updated.setValue("");
        when(outlineService.changeValue("p1", 2, null)).thenReturn(updated);

        ResponseEntity<TaskDto> response = controller.changeValue("p1", 2, new ChangeValueRequest(null));

        assertThat(response.getBody().value()).isEmpty();
        OutlineEvent event = broadcastEvent();
        assertThat(event.type()).isEqualTo(OutlineEventType.CHANGED_VALUE);
        assertThat(event.newValue()).isEmpty();
    }

    @Test
    void deleteReturnsNoContent() {
        ResponseEntity<Void> response = controller.delete("p1", 2);

        assertThat(response.getStatusCode().value()).isEqualTo(204);
        verify(outlineService).deleteTask("p1", 2);
        assertThat(broadcastEvent().type()).isEqualTo(OutlineEventType.DELETED_TASK);
    }

    @Test
    void levelAndCompletionEndpointsDelegate() {
        assertThat(controller.indent("p1", 2, "u7").getStatusCode().value()).isEqualTo(204);
        assertThat(controller.outdent("p1", 3, null).getStatusCode().value()).isEqualTo(204);
        assertThat(controller.complete("p1", 4, "u7").getStatusCode().value()).isEqualTo(204);
        assertThat(controller.uncomplete("p1", 5).getStatusCode().value()).isEqualTo(204);

        verify(outlineService).increaseLevel("p1", 2, "u7");
        verify(outlineService).decreaseLevel("p1", 3, null);
        verify(outlineService).completeTask("p1", 4, "u7");
        verify(outlineService).uncompleteTask("p1", 5);
        verify(broadcaster, times(4)).broadcast(any(), isNull());
    }

    @Test
    void failedChangeIsNotBroadcast() {
        doThrow(new IllegalStateException("boom")).when(outlineService).increaseLevel("p1", 1, null);

        try {
            controller.indent("p1", 1, null);
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("boom");
        }

        verifyNoInteractions(broadcaster);
    }
}
