package io.github.drompincen.noject.protocol.api;

/**
 * @param userId     creator of the task
 * @param prevTaskId task to insert after (as its sibling, past its subtree); {@code null} appends at the end
 */
public record AddTaskRequest(String userId, Integer prevTaskId) {}
