package io.github.drompincen.scriptops.protocol.api;

public record ErrorResponse(String code, String message) {}
