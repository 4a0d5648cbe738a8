package io.github.drompincen.scriptops.runtime.lookup;

public record CredentialProfile(
        String profileId,
        String name,
        String accessKey,
        String secretKey,
        String region
) {
    @Override
    public String toString() {
        return "CredentialProfile[profileId=" + profileId + ", name=" + name + ", region=" + region + "]";
    }
}
