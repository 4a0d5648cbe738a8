package io.github.drompincen.scriptops.runtime.error;

public class ScriptNotFoundException extends NotFoundException {

    public ScriptNotFoundException(String scriptId) {
        super("Script not found: " + scriptId);
    }
}
