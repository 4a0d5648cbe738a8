package io.github.drompincen.scriptops.runtime.lookup;

import io.github.drompincen.scriptops.persistence.document.UserDocument;
import io.github.drompincen.scriptops.persistence.repository.UserRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class MongoUserLookup implements UserLookup {

    private final UserRepository userRepository;

    public MongoUserLookup(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public Optional<String> findUsername(String userId) {
        if (userId == null) return Optional.empty();
        return userRepository.findById(userId).map(UserDocument::getUsername);
    }
}
