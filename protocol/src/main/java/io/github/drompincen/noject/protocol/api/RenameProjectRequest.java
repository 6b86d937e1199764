package io.github.drompincen.noject.protocol.api;

public record RenameProjectRequest(String name) {}
