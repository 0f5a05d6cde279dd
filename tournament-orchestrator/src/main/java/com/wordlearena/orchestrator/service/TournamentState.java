package com.wordlearena.orchestrator.service;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable run progress, written by the tournament pipeline and read by the
 * status endpoint. Fields are volatile; the episode counter is atomic because
 * episodes complete on many supervisor threads.
 */
public class TournamentState {

    public enum Status { IDLE, RUNNING, COMPLETED, STOPPED, ERROR }

    private volatile Status  status = Status.IDLE;
    private volatile String  runId;
    private volatile String  name;
    private volatile String  currentRound;
    private volatile int     roundsDone;
    private volatile int     roundsTotal;
    private volatile int     agentCount;
    private volatile int     episodesTotal;
    private final AtomicInteger episodesDone = new AtomicInteger();
    private volatile String  errorMessage;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    // ── mutators ────────────────────────────────────────────────────────────

    public void start(String runId, String name, int roundsTotal, int agentCount) {
        this.runId         = runId;
        this.name          = name;
        this.roundsTotal   = roundsTotal;
        this.agentCount    = agentCount;
        this.roundsDone    = 0;
        this.currentRound  = null;
        this.episodesTotal = 0;
        this.episodesDone.set(0);
        this.errorMessage  = null;
        this.startedAt     = Instant.now();
        this.finishedAt    = null;
        this.status        = Status.RUNNING;
    }

    public void beginRound(String roundId, int episodes) {
        this.currentRound  = roundId;
        this.episodesTotal = episodes;
        this.episodesDone.set(0);
    }

    public void episodeDone()  { episodesDone.incrementAndGet(); }

    public void roundDone()    { roundsDone++; }

    public void complete()     { finish(Status.COMPLETED); }

    public void stopped()      { finish(Status.STOPPED); }

    public void error(String msg) {
        this.errorMessage = msg;
        finish(Status.ERROR);
    }

    private void finish(Status terminal) {
        this.finishedAt = Instant.now();
        this.status     = terminal;
    }

    // ── accessors ───────────────────────────────────────────────────────────

    public Status  getStatus()        { return status; }
    public String  getRunId()         { return runId; }
    public String  getName()          { return name; }
    public String  getCurrentRound()  { return currentRound; }
    public int     getRoundsDone()    { return roundsDone; }
    public int     getRoundsTotal()   { return roundsTotal; }
    public int     getAgentCount()    { return agentCount; }
    public int     getEpisodesDone()  { return episodesDone.get(); }
    public int     getEpisodesTotal() { return episodesTotal; }
    public String  getErrorMessage()  { return errorMessage; }
    public Instant getStartedAt()     { return startedAt; }
    public Instant getFinishedAt()    { return finishedAt; }

    public boolean isRunning() {
        return status == Status.RUNNING;
    }

    public double getProgressPct() {
        return episodesTotal > 0 ? (double) episodesDone.get() / episodesTotal * 100.0 : 0.0;
    }
}
