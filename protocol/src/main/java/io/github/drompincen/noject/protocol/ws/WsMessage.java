package io.github.drompincen.noject.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WsMessage(
        WsMessageType type,
        String projectId,
        String requestId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String projectId, JsonNode payload) {
        return new WsMessage(type, projectId, null, payload, Instant.now());
    }

    public static WsMessage reply(WsMessageType type, String projectId, String requestId, JsonNode payload) {
        return new WsMessage(type, projectId, requestId, payload, Instant.now());
    }

    public static WsMessage error(String projectId, String requestId, JsonNode payload) {
        return reply(WsMessageType.ERROR, projectId, requestId, payload);
    }
}
