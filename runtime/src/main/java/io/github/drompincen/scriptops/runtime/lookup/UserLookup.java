package io.github.drompincen.scriptops.runtime.lookup;

import java.util.Optional;

public interface UserLookup {
    Optional<String> findUsername(String userId);
}
