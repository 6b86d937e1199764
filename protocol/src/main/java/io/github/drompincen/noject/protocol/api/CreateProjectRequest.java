package io.github.drompincen.noject.protocol.api;

public record CreateProjectRequest(String name, String createdBy) {}
