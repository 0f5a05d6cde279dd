package com.wordlearena.orchestrator.controller;

import com.wordlearena.orchestrator.dto.ExperimentRequest;
import com.wordlearena.orchestrator.service.ExperimentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/** Single-agent traces for agent development. */
@RestController
@RequestMapping("/api/v1/experiments")
public class ExperimentController {

    private static final Logger log = LoggerFactory.getLogger(ExperimentController.class);

    private final ExperimentService experiments;

    public ExperimentController(ExperimentService experiments) {
        this.experiments = experiments;
    }

    @PostMapping
    public Mono<ResponseEntity<Object>> run(@RequestBody ExperimentRequest request) {
        if (request.getAgent() == null || request.getAgent().isBlank()) {
            return Mono.just(ResponseEntity.status(400).<Object>body(Map.of("error", "agent is required")));
        }
        log.info("[ExperimentAPI] run. agent={} length={} mode={} games={}",
            request.getAgent(), request.getWordLength(), request.getMode(), request.getNumGames());
        return experiments.run(request)
            .map(report -> ResponseEntity.ok().<Object>body(report))
            .onErrorResume(e -> {
                log.error("[ExperimentAPI] run error. agent={} err={}", request.getAgent(), e.getMessage());
                return Mono.just(ResponseEntity.status(400).<Object>body(Map.of("error", String.valueOf(e.getMessage()))));
            });
    }
}
