package io.github.drompincen.scriptops.runtime.lookup;

import io.github.drompincen.scriptops.persistence.document.SettingDocument;
import io.github.drompincen.scriptops.persistence.repository.SettingRepository;
import org.springframework.stereotype.Component;

@Component
public class MongoSettingsLookup implements SettingsLookup {

    private final SettingRepository settingRepository;

    public MongoSettingsLookup(SettingRepository settingRepository) {
        this.settingRepository = settingRepository;
    }

    @Override
    public String get(String key, String defaultValue) {
        return settingRepository.findById(key)
                .map(SettingDocument::getValue)
                .orElse(defaultValue);
    }
}
