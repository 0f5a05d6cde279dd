package com.wordlearena.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.wordlearena.orchestrator", "com.wordlearena.agents"})
public class TournamentOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TournamentOrchestratorApplication.class, args);
    }
}
