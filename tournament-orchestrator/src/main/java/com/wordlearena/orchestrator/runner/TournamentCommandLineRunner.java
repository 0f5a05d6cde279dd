package com.wordlearena.orchestrator.runner;

import com.wordlearena.orchestrator.report.TournamentReport;
import com.wordlearena.orchestrator.service.TournamentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Batch entry point: with {@code arena.run-on-startup=true} the configured
 * tournament runs once at start-up and the application exits afterwards
 * (exit code 0 on a finished report, 1 on failure).
 */
@Component
@ConditionalOnProperty(name = "arena.run-on-startup", havingValue = "true")
public class TournamentCommandLineRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(TournamentCommandLineRunner.class);

    private final TournamentService  service;
    private final ApplicationContext context;

    public TournamentCommandLineRunner(TournamentService service, ApplicationContext context) {
        this.service = service;
        this.context = context;
    }

    @Override
    public void run(String... args) {
        int exitCode;
        try {
            TournamentReport report = service.runTournament(service.getDefaults()).block();
            if (report == null) {
                log.error("[Runner] Tournament produced no report");
                exitCode = 1;
            } else {
                log.info("[Runner] Tournament finished. id={} status={} rounds={} leader={}",
                    report.tournamentId(), report.status(), report.rounds().size(),
                    report.leaderboard().isEmpty() ? "-" : report.leaderboard().get(0).agentId());
                exitCode = 0;
            }
        } catch (RuntimeException e) {
            log.error("[Runner] Tournament failed. err={}", e.getMessage(), e);
            exitCode = 1;
        }
        int code = exitCode;
        System.exit(SpringApplication.exit(context, () -> code));
    }
}
