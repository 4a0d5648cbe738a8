package io.github.drompincen.scriptops.runtime.execution;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@Configuration
@EnableAutoConfiguration
@EnableMongoRepositories(basePackages = "io.github.drompincen.scriptops.persistence.repository")
public class TestMongoConfiguration {

    static {
        String arch = System.getProperty("os.arch", "");
        if (arch.equals("aarch64") || arch.equals("arm64")) {
            System.setProperty("os.arch", "amd64");
        }
    }
}
