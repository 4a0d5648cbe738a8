package io.github.drompincen.scriptops.runtime.lookup;

import io.github.drompincen.scriptops.persistence.repository.ScriptRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class MongoScriptLookup implements ScriptLookup {

    private final ScriptRepository scriptRepository;

    public MongoScriptLookup(ScriptRepository scriptRepository) {
        this.scriptRepository = scriptRepository;
    }

    @Override
    public Optional<ScriptInfo> findScript(String scriptId) {
        if (scriptId == null) return Optional.empty();
        return scriptRepository.findById(scriptId)
                .map(doc -> new ScriptInfo(doc.getScriptId(), doc.getName(), doc.getPath()));
    }
}
