package com.graphrecall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GraphRecall Server Application
 *
 * Records free-text statements into a per-user knowledge graph and answers
 * questions from it. Built with Spring Boot WebFlux and R2DBC.
 */
@SpringBootApplication
public class GraphRecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphRecallApplication.class, args);
    }

}
