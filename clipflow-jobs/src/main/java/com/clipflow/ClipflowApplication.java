package com.clipflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EntityScan("com.clipflow.publisher.model")
@EnableJpaRepositories("com.clipflow.publisher.repository")
public class ClipflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClipflowApplication.class, args);
    }

}
