package io.github.drompincen.scriptops.runtime.lookup;

import io.github.drompincen.scriptops.persistence.repository.AwsProfileRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class MongoCredentialProfileLookup implements CredentialProfileLookup {

    private final AwsProfileRepository profileRepository;

    public MongoCredentialProfileLookup(AwsProfileRepository profileRepository) {
        this.profileRepository = profileRepository;
    }

    @Override
    public Optional<CredentialProfile> findProfile(String profileId) {
        if (profileId == null) return Optional.empty();
        return profileRepository.findById(profileId)
                .map(doc -> new CredentialProfile(doc.getProfileId(), doc.getName(),
                        doc.getAccessKey(), doc.getSecretKey(), doc.getRegion()));
    }
}
