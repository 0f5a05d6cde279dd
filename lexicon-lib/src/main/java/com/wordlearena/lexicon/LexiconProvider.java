package com.wordlearena.lexicon;

import com.wordlearena.common.model.DistributionMode;

/**
 * Source of vocabularies and their probability distributions.
 */
public interface LexiconProvider {

    /**
     * @param maxVocabularySize keep only the N most frequent words; {@code <= 0} keeps all
     * @throws LexiconException when no corpus exists for the length or it holds no usable word
     */
    Lexicon load(int wordLength, DistributionMode mode, int maxVocabularySize);

    default Lexicon load(int wordLength, DistributionMode mode) {
        return load(wordLength, mode, 0);
    }
}
