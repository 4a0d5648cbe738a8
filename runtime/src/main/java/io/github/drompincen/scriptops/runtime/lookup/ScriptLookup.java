package io.github.drompincen.scriptops.runtime.lookup;

import java.util.Optional;

public interface ScriptLookup {
    Optional<ScriptInfo> findScript(String scriptId);
}
