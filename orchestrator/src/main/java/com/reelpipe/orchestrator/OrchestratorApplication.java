package com.reelpipe.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Pipeline job orchestrator.
 *
 * To run:
 *   DB_URL=jdbc:postgresql://localhost:5432/reelpipe GENERATION_URL=http://localhost:8000 \
 *     mvn -pl orchestrator spring-boot:run
 *
 * Jobs advance only when something ticks them: a client calling
 * POST /jobs/{id}/tick, or the embedded driver (reelpipe.driver.embedded=true).
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
