package io.github.drompincen.noject.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.noject.gateway.mapping.OutlineMapper;
import io.github.drompincen.noject.persistence.document.TaskDocument;
import io.github.drompincen.noject.protocol.event.OutlineEvent;
import io.github.drompincen.noject.protocol.event.OutlineEventType;
import io.github.drompincen.noject.protocol.ws.WsErrorKind;
import io.github.drompincen.noject.protocol.ws.WsMessage;
import io.github.drompincen.noject.protocol.ws.WsMessageType;
import io.github.drompincen.noject.runtime.outline.LevelBoundaryException;
import io.github.drompincen.noject.runtime.outline.OutlineBroadcaster;
import io.github.drompincen.noject.runtime.outline.OutlineException;
import io.github.drompincen.noject.runtime.outline.OutlinePersistenceException;
import io.github.drompincen.noject.runtime.outline.OutlineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Outline collaboration endpoint. A connection joins a project, sends outline
 * commands and gets a RESULT (or ERROR) back; every other connection that
 * joined the same project receives the change as an EVENT.
 *
 * <p>Command fields are read from {@code payload} when present, otherwise from
 * the message itself.
 */
@Component
public class OutlineWebSocketHandler extends TextWebSocketHandler implements OutlineBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(OutlineWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final OutlineService outlineService;
    private final Map<String, Set<WebSocketSession>> projectSubscriptions = new ConcurrentHashMap<>();

    public OutlineWebSocketHandler(ObjectMapper objectMapper, OutlineService outlineService) {
        this.objectMapper = objectMapper;
        this.outlineService = outlineService;
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        projectSubscriptions.keySet().forEach(projectId -> leave(projectId, session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode node;
        WsMessageType type;
        try {
            node = objectMapper.readTree(message.getPayload());
            type = WsMessageType.valueOf(node.path("type").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            sendError(session, null, null, WsErrorKind.BAD_REQUEST, "Unreadable message: " + e.getMessage());
            return;
        }
        String projectId = node.path("projectId").asText(null);
        String requestId = node.path("requestId").asText(null);
        if (projectId == null || projectId.isBlank()) {
            sendError(session, null, requestId, WsErrorKind.BAD_REQUEST, "projectId is required");
            return;
        }

        switch (type) {
            case PROJECT_JOIN -> {
                join(projectId, session);
                send(session, WsMessage.reply(WsMessageType.JOINED, projectId, requestId, null));
            }
            case PROJECT_LEAVE -> {
                leave(projectId, session);
                send(session, WsMessage.reply(WsMessageType.LEFT, projectId, requestId, null));
            }
            default -> {
                if (type.isOutlineCommand()) {
                    handleCommand(session, type, projectId, requestId, node.has("payload") ? node.get("payload") : node);
                } else {
                    sendError(session, projectId, requestId, WsErrorKind.BAD_REQUEST, type + " is not a client message");
                }
            }
        }
    }

    private void handleCommand(WebSocketSession session, WsMessageType type, String projectId,
                               String requestId, JsonNode args) {
        OutlineEvent event;
        try {
            event = execute(type, projectId, args);
        } catch (IllegalArgumentException e) {
            sendError(session, projectId, requestId, WsErrorKind.BAD_REQUEST, e.getMessage());
            return;
        } catch (OutlineException e) {
            sendError(session, projectId, requestId, kindOf(e), e.getMessage());
            return;
        }
        send(session, WsMessage.reply(WsMessageType.RESULT, projectId, requestId, objectMapper.valueToTree(event)));
        broadcast(event, session.getId());
    }

    private OutlineEvent execute(WsMessageType type, String projectId, JsonNode args) {
        return switch (type) {
            case ADD_TASK -> {
                Integer prev = args.hasNonNull("prevTaskId") ? intField(args, "prevTaskId") : null;
                TaskDocument task = outlineService.addTask(projectId, args.path("userId").asText(null), prev);
                yield OutlineEvent.addedTask(projectId, OutlineMapper.toDto(task));
            }
            case CHANGE_VALUE -> {
                int taskId = intField(args, "taskId");
                TaskDocument task = outlineService.changeValue(projectId, taskId, args.path("value").asText(""));
                yield OutlineEvent.changedValue(projectId, taskId, task.getValue());
            }
            case DELETE_TASK -> {
                int taskId = intField(args, "taskId");
                outlineService.deleteTask(projectId, taskId);
                yield OutlineEvent.of(OutlineEventType.DELETED_TASK, projectId, taskId);
            }
            case INCREASE_LEVEL -> {
                int taskId = intField(args, "taskId");
                outlineService.increaseLevel(projectId, taskId, args.path("userId").asText(null));
                yield OutlineEvent.of(OutlineEventType.INCREASED_LEVEL, projectId, taskId);
            }
            case DECREASE_LEVEL -> {
                int taskId = intField(args, "taskId");
                outlineService.decreaseLevel(projectId, taskId, args.path("userId").asText(null));
                yield OutlineEvent.of(OutlineEventType.DECREASED_LEVEL, projectId, taskId);
            }
            case COMPLETE_TASK -> {
                int taskId = intField(args, "taskId");
                outlineService.completeTask(projectId, taskId, args.path("userId").asText(null));
                yield OutlineEvent.of(OutlineEventType.COMPLETED_TASK, projectId, taskId);
            }
            case UNCOMPLETE_TASK -> {
                int taskId = intField(args, "taskId");
                outlineService.uncompleteTask(projectId, taskId);
                yield OutlineEvent.of(OutlineEventType.UNCOMPLETED_TASK, projectId, taskId);
            }
            default -> throw new IllegalArgumentException(type + " is not an outline command");
        };
    }

    @Override
    public void broadcast(OutlineEvent event, String originId) {
        Set<WebSocketSession> subscribers = projectSubscriptions.get(event.projectId());
        if (subscribers == null) {
            return;
        }
        WsMessage msg = WsMessage.of(WsMessageType.EVENT, event.projectId(), objectMapper.valueToTree(event));
        for (WebSocketSession ws : subscribers) {
            if (ws.isOpen() && !ws.getId().equals(originId)) {
                send(ws, msg);
            }
        }
    }

    int subscriberCount(String projectId) {
        Set<WebSocketSession> sessions = projectSubscriptions.get(projectId);
        return sessions == null ? 0 : sessions.size();
    }

    // Join and leave both run inside the map's per-key compute so an empty set
    // is never dropped while a join is adding to it.
    private void join(String projectId, WebSocketSession session) {
        projectSubscriptions.compute(projectId, (k, sessions) -> {
            Set<WebSocketSession> joined = sessions != null ? sessions : new CopyOnWriteArraySet<>();
            joined.add(session);
            return joined;
        });
    }

    private void leave(String projectId, WebSocketSession session) {
        projectSubscriptions.computeIfPresent(projectId, (k, sessions) -> {
            sessions.remove(session);
            return sessions.isEmpty() ? null : sessions;
        });
    }

    private static int intField(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return value.asInt();
    }

    private static WsErrorKind kindOf(OutlineException e) {
        if (e instanceof LevelBoundaryException) {
            return WsErrorKind.BOUNDARY;
        }
        if (e instanceof OutlinePersistenceException) {
            return WsErrorKind.PERSISTENCE;
        }
        return WsErrorKind.NOT_FOUND;
    }

    private void sendError(WebSocketSession session, String projectId, String requestId,
                           WsErrorKind kind, String message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("kind", kind.name());
        payload.put("message", message);
        send(session, WsMessage.error(projectId, requestId, payload));
    }

    private void send(WebSocketSession session, WsMessage msg) {
        try {
            String json = objectMapper.writeValueAsString(msg);
            // sendMessage must not be called concurrently on one session
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.error("Failed to send {} to WebSocket session {}", msg.type(), session.getId(), e);
        }
    }
}
