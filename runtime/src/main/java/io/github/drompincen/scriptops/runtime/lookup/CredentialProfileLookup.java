package io.github.drompincen.scriptops.runtime.lookup;

import java.util.Optional;

public interface CredentialProfileLookup {
    Optional<CredentialProfile> findProfile(String profileId);
}
