package com.wordlearena.orchestrator.isolation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordlearena.common.model.GameOutcome;
import com.wordlearena.common.model.GameResult;
import com.wordlearena.orchestrator.game.EpisodeRequest;
import com.wordlearena.orchestrator.game.GameRunner;
import com.wordlearena.orchestrator.registry.AgentInstantiator;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of a child episode JVM.
 *
 * <p>Reads one {@link EpisodeRequest} from stdin, plays it with an in-process
 * thread watchdog and writes the {@link GameResult} to stdout. Anything the
 * agent prints goes to stderr so it cannot corrupt the result channel.
 * Always exits, so stray agent threads die with the process.
 */
public final class EpisodeWorkerMain {

    private EpisodeWorkerMain() {}

    public static void main(String[] args) {
        PrintStream resultChannel = new PrintStream(new FileOutputStream(FileDescriptor.out), true);
        System.setOut(System.err);
        System.exit(run(System.in, resultChannel));
    }

    /** Plays the request read from {@code in} and writes the result to {@code out}; returns the exit code. */
    static int run(InputStream in, OutputStream out) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            EpisodeRequest request = mapper.readValue(in, EpisodeRequest.class);
            GameResult result = play(request);
            out.write(mapper.writeValueAsBytes(result));
            out.flush();
            return 0;
        } catch (Exception e) {
            System.err.println("[EpisodeWorker] failed: " + e);
            return 1;
        }
    }

    static GameResult play(EpisodeRequest request) throws InterruptedException {
        ThreadEpisodeExecutor executor = new ThreadEpisodeExecutor(new GameRunner(new AgentInstantiator()));
        EpisodeHandle handle = executor.submit(request);
        try {
            return handle.await(executor.watchdogTimeout(request));
        } catch (TimeoutException e) {
            return GameResult.unsolved(request.agentId(), request.secret(), List.of(), request.maxGuesses(),
                GameOutcome.TIMED_OUT, request.budgetMillis(), "episode exceeded its budget");
        } finally {
            handle.close();
        }
    }
}
