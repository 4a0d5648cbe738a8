package io.github.drompincen.scriptops.runtime.lookup;

public record ScriptInfo(String scriptId, String name, String path) {}
