package io.github.drompincen.noject.protocol.ws;

/** Category of an {@link WsMessageType#ERROR} reply. */
public enum WsErrorKind {
    NOT_FOUND,
    BOUNDARY,
    PERSISTENCE,
    BAD_REQUEST
}
