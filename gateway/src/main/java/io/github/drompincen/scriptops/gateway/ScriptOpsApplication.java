package io.github.drompincen.scriptops.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.scriptops")
@EnableMongoRepositories(basePackages = "io.github.drompincen.scriptops.persistence.repository")
@EnableScheduling
public class ScriptOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptOpsApplication.class, args);
    }
}
