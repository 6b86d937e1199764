package io.github.drompincen.noject.protocol.event;

public enum OutlineEventType {
    ADDED_TASK,
    CHANGED_VALUE,
    DELETED_TASK,
    INCREASED_LEVEL,
    DECREASED_LEVEL,
    COMPLETED_TASK,
    UNCOMPLETED_TASK
}
