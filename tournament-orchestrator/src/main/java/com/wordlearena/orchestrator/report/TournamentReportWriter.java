package com.wordlearena.orchestrator.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists reports as pretty-printed JSON.
 *
 * <pre>
 *   &lt;results-dir&gt;/runs/&lt;tournamentId&gt;/tournament_results.json
 *   &lt;results-dir&gt;/latest.json            (copy of the most recent run)
 * </pre>
 */
@Component
public class TournamentReportWriter {

    private static final Logger log = LoggerFactory.getLogger(TournamentReportWriter.class);

    static final String REPORT_FILE = "tournament_results.json";
    static final String LATEST_FILE = "latest.json";

    private final ObjectMapper mapper;
    private final Path resultsDir;

    @Autowired
    public TournamentReportWriter(ObjectMapper mapper,
                                  @Value("${arena.results-dir:results}") String resultsDir) {
        this(mapper, Path.of(resultsDir));
    }

    public TournamentReportWriter(ObjectMapper mapper, Path resultsDir) {
        this.mapper     = mapper;
        this.resultsDir = resultsDir;
    }

    /** @return path of the per-run report file */
    public Path write(TournamentReport report) {
        Path runDir = resultsDir.resolve("runs").resolve(report.tournamentId());
        Path file   = runDir.resolve(REPORT_FILE);
        Path latest = resultsDir.resolve(LATEST_FILE);
        try {
            Files.createDirectories(runDir);
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
            Files.copy(file, latest, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + file, e);
        }
        log.info("[Report] Written. tournamentId={} path={} latest={}", report.tournamentId(), file, latest);
        return file;
    }

    /** Reads {@code latest.json} if present, e.g. after a restart. */
    public Optional<TournamentReport> readLatest() {
        Path latest = resultsDir.resolve(LATEST_FILE);
        if (!Files.isRegularFile(latest)) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(latest.toFile(), TournamentReport.class));
        } catch (IOException e) {
            log.warn("[Report] Unreadable latest report. path={} err={}", latest, e.getMessage());
            return Optional.empty();
        }
    }

    public Path getResultsDir() {
        return resultsDir;
    }
}
