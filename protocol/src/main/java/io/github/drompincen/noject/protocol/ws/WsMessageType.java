package io.github.drompincen.noject.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    PROJECT_JOIN,
    PROJECT_LEAVE,
    ADD_TASK,
    CHANGE_VALUE,
    DELETE_TASK,
    INCREASE_LEVEL,
    DECREASE_LEVEL,
    COMPLETE_TASK,
    UNCOMPLETE_TASK,

    // Server -> Client
    JOINED,
    LEFT,
    RESULT,
    EVENT,
    ERROR;

    public boolean isOutlineCommand() {
        return switch (this) {
            case ADD_TASK, CHANGE_VALUE, DELETE_TASK, INCREASE_LEVEL,
                 DECREASE_LEVEL, COMPLETE_TASK, UNCOMPLETE_TASK -> true;
            default -> false;
        };
    }
}
