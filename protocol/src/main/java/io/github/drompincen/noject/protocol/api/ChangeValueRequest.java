package io.github.drompincen.noject.protocol.api;

public record ChangeValueRequest(String value) {}
