package com.wordlearena.lexicon;

import com.wordlearena.common.model.DistributionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizing decorator. Corpora are read once per (length, mode, size) and the
 * immutable {@link Lexicon} is shared by every round that needs it.
 */
public class LexiconCache implements LexiconProvider {

    private static final Logger log = LoggerFactory.getLogger(LexiconCache.class);

    private record Key(int wordLength, DistributionMode mode, int maxVocabularySize) {}

    private final LexiconProvider delegate;
    private final Map<Key, Lexicon> cache = new ConcurrentHashMap<>();

    public LexiconCache(LexiconProvider delegate) {
        this.delegate = delegate;
    }

    @Override
    public Lexicon load(int wordLength, DistributionMode mode, int maxVocabularySize) {
        Key key = new Key(wordLength, mode, Math.max(0, maxVocabularySize));
        // failures are not cached; computeIfAbsent rethrows and leaves no mapping
        return cache.computeIfAbsent(key, k -> {
            log.debug("[Lexicon] Cache miss. length={} mode={} maxSize={}",
                k.wordLength(), k.mode().label(), k.maxVocabularySize());
            return delegate.load(k.wordLength(), k.mode(), k.maxVocabularySize());
        });
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}
