package com.wordlearena.agents;

import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.matching.CandidateFilter;
import com.wordlearena.common.model.GameConfig;
import com.wordlearena.common.model.GuessRecord;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/** Uniform pick among the candidates still consistent with the history. */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class RandomAgent implements GuessingAgent {

    private final Random rng;
    private List<String> vocabulary = List.of();

    public RandomAgent() {
        this(new Random());
    }

    public RandomAgent(Random rng) {
        this.rng = rng;
    }

    @Override
    public String agentId() { return "Random"; }

    @Override
    public void beginGame(GameConfig config) {
        this.vocabulary = List.copyOf(config.vocabulary());
    }

    @Override
    public String guess(List<GuessRecord> history) {
        List<String> candidates = CandidateFilter.filter(vocabulary, history);
        if (candidates.isEmpty()) {
            return vocabulary.get(0);
        }
        return candidates.get(rng.nextInt(candidates.size()));
    }
}
