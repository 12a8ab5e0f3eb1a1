package io.github.drompincen.boardpilot.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.boardpilot")
@EnableMongoRepositories(basePackages = "io.github.drompincen.boardpilot.persistence.repository")
public class BoardPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoardPilotApplication.class, args);
    }
}
