package com.researchmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ResearchMatch Application
 *
 * Semantic similarity search and recommendations over embedded
 * company research, built on Spring Boot WebFlux and R2DBC.
 */
@SpringBootApplication
public class ResearchMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchMatchApplication.class, args);
    }

}
