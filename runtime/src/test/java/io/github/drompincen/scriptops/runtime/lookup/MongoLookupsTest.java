package io.github.drompincen.scriptops.runtime.lookup;

import io.github.drompincen.scriptops.persistence.document.AwsProfileDocument;
import io.github.drompincen.scriptops.persistence.document.SettingDocument;
import io.github.drompincen.scriptops.persistence.repository.AwsProfileRepository;
import io.github.drompincen.scriptops.persistence.repository.SettingRepository;
import io.github.drompincen.scriptops.persistence.repository.UserRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoLookupsTest {

    @Mock private SettingRepository settingRepository;
    @Mock private AwsProfileRepository profileRepository;
    @Mock private UserRepository userRepository;

    @Test
    void settings_returnStoredValueOrDefault() {
        when(settingRepository.findById("history_limit"))
                .thenReturn(Optional.of(new SettingDocument("history_limit", "25")));
        when(settingRepository.findById("EXECUTION_TIMEOUT")).thenReturn(Optional.empty());
        MongoSettingsLookup lookup = new MongoSettingsLookup(settingRepository);

        assertThat(lookup.get(SettingsLookup.HISTORY_LIMIT, "10")).isEqualTo("25");
        assertThat(lookup.get(SettingsLookup.EXECUTION_TIMEOUT, "30")).isEqualTo("30");
    }

    @Test
    void profile_mapsDocumentAndHidesSecretsInToString() {
        AwsProfileDocument doc = new AwsProfileDocument();
        doc.setProfileId("p1");
        doc.setName("prod");
        doc.setAccessKey("AKIA123");
        doc.setSecretKey("very-secret");
        doc.setRegion("ca-central-1");
        when(profileRepository.findById("p1")).thenReturn(Optional.of(doc));

        CredentialProfile profile = new MongoCredentialProfileLookup(profileRepository).findProfile("p1").orElseThrow();

        assertThat(profile.region()).isEqualTo("ca-central-1");
        assertThat(profile.secretKey()).isEqualTo("very-secret");
        assertThat(profile.toString()).doesNotContain("very-secret", "AKIA123");
    }

    @Test
    void nullIds_resolveToEmptyWithoutQuery() {
        assertThat(new MongoCredentialProfileLookup(profileRepository).findProfile(null)).isEmpty();
        assertThat(new MongoUserLookup(userRepository).findUsername(null)).isEmpty();
        verify(userRepository, never()).findById(any());
    }
}
