package com.wordlearena.orchestrator.game;

import com.wordlearena.common.model.GuessRecord;

/** Observes every answered turn of a game. Used by experiments to trace play. */
@FunctionalInterface
public interface TurnListener {

    TurnListener NONE = (turn, record) -> {};

    void onTurn(int turn, GuessRecord record);
}
