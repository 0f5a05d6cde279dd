package com.wordlearena.agents;

import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.matching.CandidateFilter;
import com.wordlearena.common.model.GameConfig;
import com.wordlearena.common.model.GuessRecord;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Always guesses the most probable remaining candidate.
 *
 * <p>Under a uniform distribution this degenerates to the alphabetically first
 * candidate. The vocabulary is pre-sorted once per game by descending
 * probability, then alphabetically, and filtering preserves that order.
 * With no consistent candidate left it falls back to the first vocabulary word.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class MaxProbabilityAgent implements GuessingAgent {

    private List<String> vocabulary = List.of();
    private List<String> ranked = List.of();

    @Override
    public String agentId() { return "MaxProb"; }

    @Override
    public void beginGame(GameConfig config) {
        List<String> words = new ArrayList<>(config.vocabulary());
        words.sort(Comparator.comparingDouble((String w) -> config.probabilityOf(w)).reversed()
            .thenComparing(Comparator.naturalOrder()));
        this.vocabulary = config.vocabulary();
        this.ranked = words;
    }

    @Override
    public String guess(List<GuessRecord> history) {
        List<String> candidates = CandidateFilter.filter(ranked, history);
        return candidates.isEmpty() ? vocabulary.get(0) : candidates.get(0);
    }
}
