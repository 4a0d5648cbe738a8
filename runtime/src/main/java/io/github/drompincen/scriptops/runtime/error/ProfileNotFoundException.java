package io.github.drompincen.scriptops.runtime.error;

public class ProfileNotFoundException extends NotFoundException {

    public ProfileNotFoundException(String profileId) {
        super("AWS profile not found: " + profileId);
    }
}
