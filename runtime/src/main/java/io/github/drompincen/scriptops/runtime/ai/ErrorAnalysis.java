package io.github.drompincen.scriptops.runtime.ai;

public record ErrorAnalysis(String analysis, String solution) {}
