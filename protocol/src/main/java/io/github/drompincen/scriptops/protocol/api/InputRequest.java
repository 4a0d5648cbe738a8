package io.github.drompincen.scriptops.protocol.api;

public record InputRequest(String input) {}
