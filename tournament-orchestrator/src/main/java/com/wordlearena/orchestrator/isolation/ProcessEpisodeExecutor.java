package com.wordlearena.orchestrator.isolation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordlearena.common.model.GameOutcome;
import com.wordlearena.common.model.GameResult;
import com.wordlearena.orchestrator.game.EpisodeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs each episode in a child JVM ({@link EpisodeWorkerMain}).
 *
 * <p>The child is started with a heap ceiling, one visible processor and the
 * serial collector. The {@link EpisodeRequest} goes to its stdin as JSON and
 * the {@link GameResult} comes back on stdout. The child enforces the budget
 * itself; the parent allows {@code budget + startupGrace} for JVM start-up and
 * then destroys the process forcibly.
 */
public class ProcessEpisodeExecutor implements EpisodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessEpisodeExecutor.class);

    private final ObjectMapper mapper;
    private final String javaCommand;
    private final String classpath;
    private final int memoryLimitMb;
    private final Duration startupGrace;

    public ProcessEpisodeExecutor(ObjectMapper mapper, String javaCommand, String classpath,
                                  int memoryLimitMb, Duration startupGrace) {
        this.mapper        = mapper;
        this.javaCommand   = javaCommand;
        this.classpath     = classpath;
        this.memoryLimitMb = memoryLimitMb;
        this.startupGrace  = startupGrace;
    }

    List<String> command() {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaCommand);
        cmd.add("-Xmx" + memoryLimitMb + "m");
        cmd.add("-XX:ActiveProcessorCount=1");
        cmd.add("-XX:+UseSerialGC");
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(EpisodeWorkerMain.class.getName());
        return cmd;
    }

    @Override
    public EpisodeHandle submit(EpisodeRequest request) {
        long submittedAt = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command())
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        } catch (IOException e) {
            log.error("[Isolation] Worker launch failed. episode={} cmd={}", request.episodeId(), javaCommand, e);
            return CompletedEpisodeHandle.of(faulted(request, submittedAt, "worker launch failed: " + e.getMessage()));
        }

        // one drain thread per child, started before the request is sent
        CompletableFuture<byte[]> stdout = drain(request, process);

        try (OutputStream stdin = process.getOutputStream()) {
            mapper.writeValue(stdin, request);
        } catch (IOException e) {
            process.destroyForcibly();
            return CompletedEpisodeHandle.of(faulted(request, submittedAt, "could not send episode to worker: " + e.getMessage()));
        }
        return new ProcessEpisodeHandle(request, process, stdout, submittedAt);
    }

    private static CompletableFuture<byte[]> drain(EpisodeRequest request, Process process) {
        CompletableFuture<byte[]> stdout = new CompletableFuture<>();
        Thread reader = new Thread(() -> {
            try (InputStream in = process.getInputStream()) {
                stdout.complete(in.readAllBytes());
            } catch (IOException e) {
                stdout.complete(new byte[0]);
            }
        }, "episode-stdout-" + request.episodeId());
        reader.setDaemon(true);
        reader.start();
        return stdout;
    }

    @Override
    public Duration watchdogTimeout(EpisodeRequest request) {
        return Duration.ofMillis(request.budgetMillis()).plus(startupGrace);
    }

    @Override
    public String mode() {
        return "process";
    }

    private static GameResult faulted(EpisodeRequest request, long startNanos, String reason) {
        return GameResult.unsolved(request.agentId(), request.secret(), List.of(), request.maxGuesses(),
            GameOutcome.FAULTED, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), reason);
    }

    final class ProcessEpisodeHandle implements EpisodeHandle {

        private final EpisodeRequest request;
        private final Process process;
        private final CompletableFuture<byte[]> stdout;
        private final long submittedAt;

        ProcessEpisodeHandle(EpisodeRequest request, Process process, CompletableFuture<byte[]> stdout, long submittedAt) {
            this.request     = request;
            this.process     = process;
            this.stdout      = stdout;
            this.submittedAt = submittedAt;
        }

        @Override
        public GameResult await(Duration timeout) throws TimeoutException, InterruptedException {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TimeoutException("worker for episode " + request.episodeId() + " still running after " + timeout);
            }
            int exitCode = process.exitValue();
            byte[] output;
            try {
                // the child has exited, so its pipe is at EOF; this only waits for the drain thread to finish
                output = stdout.get(startupGrace.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException | TimeoutException e) {
                log.warn("[Isolation] Worker output not drained. episode={} agent={} err={}",
                    request.episodeId(), request.agentId(), e.toString());
                return faulted(request, submittedAt, "worker output not drained: " + e);
            }
            if (exitCode != 0 || output.length == 0) {
                log.warn("[Isolation] Worker died. episode={} agent={} exitCode={}",
                    request.episodeId(), request.agentId(), exitCode);
                return faulted(request, submittedAt, "worker exited with code " + exitCode);
            }
            try {
                return mapper.readValue(output, GameResult.class);
            } catch (IOException e) {
                return faulted(request, submittedAt, "unreadable worker result: " + e.getMessage());
            }
        }

        Process process() {
            return process;
        }

        @Override
        public boolean isDone() {
            return !process.isAlive();
        }

        @Override
        public void close() {
            if (process.isAlive()) {
                log.warn("[Isolation] Killing worker. episode={} agent={} pid={}",
                    request.episodeId(), request.agentId(), process.pid());
                process.destroyForcibly();
            }
        }
    }
}
