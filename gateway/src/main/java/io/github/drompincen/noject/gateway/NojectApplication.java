package io.github.drompincen.noject.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.noject")
@EnableMongoRepositories(basePackages = "io.github.drompincen.noject.persistence.repository")
public class NojectApplication {

    public static void main(String[] args) {
        SpringApplication.run(NojectApplication.class, args);
    }
}
