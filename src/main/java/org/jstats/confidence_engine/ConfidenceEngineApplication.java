package org.jstats.confidence_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConfidenceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfidenceEngineApplication.class, args);
    }
}
