package com.wordlearena.orchestrator.controller;

import com.wordlearena.orchestrator.dto.TournamentRequest;
import com.wordlearena.orchestrator.registry.AgentDescriptor;
import com.wordlearena.orchestrator.registry.AgentRegistry;
import com.wordlearena.orchestrator.report.TournamentReport;
import com.wordlearena.orchestrator.service.TournamentService;
import com.wordlearena.orchestrator.service.TournamentSettingsResolver;
import com.wordlearena.orchestrator.service.TournamentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST control for tournament runs.
 *
 * <p>Typical operator flow:
 * <ol>
 *   <li>GET  /agents to see the registered field</li>
 *   <li>POST /start with an optional {@link TournamentRequest} body</li>
 *   <li>GET  /status to poll progress</li>
 *   <li>POST /stop to cut the run short (the current round is reported INCOMPLETE)</li>
 *   <li>GET  /latest for the last finished report</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/tournaments")
public class TournamentController {

    private static final Logger log = LoggerFactory.getLogger(TournamentController.class);

    private final TournamentService service;
    private final AgentRegistry     registry;

    public TournamentController(TournamentService service, AgentRegistry registry) {
        this.service  = service;
        this.registry = registry;
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<Map<String, Object>>> start(@RequestBody(required = false) TournamentRequest request) {
        log.info("[TournamentAPI] start. request={}", request);
        return Mono.fromCallable(() -> TournamentSettingsResolver.resolve(request, service.getDefaults()))
            .flatMap(service::start)
            .map(s -> ResponseEntity.ok(stateToMap(s)))
            .onErrorResume(e -> {
                log.error("[TournamentAPI] start error. err={}", e.getMessage());
                return Mono.just(ResponseEntity.<Map<String, Object>>status(400)
                    .body(Map.of("error", String.valueOf(e.getMessage()))));
            });
    }

    /** Signals the running tournament to stop. A no-op when idle. */
    @PostMapping("/stop")
    public Mono<ResponseEntity<String>> stop() {
        log.info("[TournamentAPI] stop requested");
        return service.stop()
            .then(Mono.just(ResponseEntity.ok("Stop signal sent")));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(stateToMap(service.getState()));
    }

    @GetMapping("/latest")
    public ResponseEntity<TournamentReport> latest() {
        return service.latestReport()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/agents")
    public ResponseEntity<List<AgentDescriptor>> agents() {
        return ResponseEntity.ok(registry.all());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Map<String, Object> stateToMap(TournamentState s) {
        // LinkedHashMap: Map.of caps at ten entries
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status",        s.getStatus().name());
        m.put("runId",         s.getRunId() != null ? s.getRunId() : "");
        m.put("name",          s.getName() != null ? s.getName() : "");
        m.put("currentRound",  s.getCurrentRound() != null ? s.getCurrentRound() : "");
        m.put("roundsDone",    s.getRoundsDone());
        m.put("roundsTotal",   s.getRoundsTotal());
        m.put("agents",        s.getAgentCount());
        m.put("episodesDone",  s.getEpisodesDone());
        m.put("episodesTotal", s.getEpisodesTotal());
        m.put("progressPct",   Math.round(s.getProgressPct() * 10.0) / 10.0);
        m.put("startedAt",     s.getStartedAt() != null ? s.getStartedAt().toString() : "");
        m.put("finishedAt",    s.getFinishedAt() != null ? s.getFinishedAt().toString() : "");
        m.put("errorMessage",  s.getErrorMessage() != null ? s.getErrorMessage() : "");
        return m;
    }
}
