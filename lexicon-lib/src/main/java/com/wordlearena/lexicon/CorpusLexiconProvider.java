package com.wordlearena.lexicon;

import com.wordlearena.common.model.DistributionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Loads {@code words_<n>.csv} or {@code words_<n>.txt}.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>the configured corpus directory, if any</li>
 *   <li>the bundled classpath corpus under {@code lexicon/}</li>
 * </ol>
 * Within one location the CSV file wins over the plain-text file.
 */
public class CorpusLexiconProvider implements LexiconProvider {

    private static final Logger log = LoggerFactory.getLogger(CorpusLexiconProvider.class);

    static final String CLASSPATH_ROOT = "lexicon/";

    private final Path directory;
    private final ClassLoader classLoader;

    public CorpusLexiconProvider() {
        this(null);
    }

    /** @param directory corpus directory searched before the classpath; may be null */
    public CorpusLexiconProvider(Path directory) {
        this(directory, CorpusLexiconProvider.class.getClassLoader());
    }

    CorpusLexiconProvider(Path directory, ClassLoader classLoader) {
        this.directory   = directory;
        this.classLoader = classLoader;
    }

    @Override
    public Lexicon load(int wordLength, DistributionMode mode, int maxVocabularySize) {
        if (wordLength <= 0) {
            throw new LexiconException("word length must be positive, got " + wordLength);
        }
        Map<String, Long> counts = readCounts(wordLength);
        if (counts.isEmpty()) {
            throw new LexiconException("No " + wordLength + "-letter words found in corpus");
        }

        List<String> words = selectWords(counts, maxVocabularySize);
        Map<String, Double> probabilities = mode == DistributionMode.FREQUENCY
            ? FrequencyWeighting.sigmoid(words, counts)
            : FrequencyWeighting.uniform(words);

        log.info("[Lexicon] Loaded. length={} mode={} words={} maxSize={}",
            wordLength, mode.label(), words.size(), maxVocabularySize);
        return new Lexicon(wordLength, mode, words, probabilities);
    }

    /** Top-N by count (ties alphabetical) when limited, then sorted alphabetically. */
    static List<String> selectWords(Map<String, Long> counts, int maxVocabularySize) {
        List<String> words = new ArrayList<>(counts.keySet());
        if (maxVocabularySize > 0 && words.size() > maxVocabularySize) {
            words.sort(Comparator.comparing((String w) -> counts.get(w)).reversed()
                .thenComparing(Comparator.naturalOrder()));
            words = new ArrayList<>(words.subList(0, maxVocabularySize));
        }
        words.sort(Comparator.naturalOrder());
        return words;
    }

    private Map<String, Long> readCounts(int wordLength) {
        String csvName = "words_" + wordLength + ".csv";
        String txtName = "words_" + wordLength + ".txt";

        if (directory != null) {
            for (String name : List.of(csvName, txtName)) {
                Path file = directory.resolve(name);
                if (Files.isRegularFile(file)) {
                    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                        return parse(reader, name, wordLength, file.toString());
                    } catch (IOException e) {
                        throw new LexiconException("Failed to read corpus " + file, e);
                    }
                }
            }
            log.debug("[Lexicon] No corpus in directory. dir={} length={}", directory, wordLength);
        }

        for (String name : List.of(csvName, txtName)) {
            InputStream in = classLoader.getResourceAsStream(CLASSPATH_ROOT + name);
            if (in == null) continue;
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return parse(reader, name, wordLength, "classpath:" + CLASSPATH_ROOT + name);
            } catch (IOException e) {
                throw new LexiconException("Failed to read bundled corpus " + name, e);
            }
        }
        throw new LexiconException("No word list found for " + wordLength + "-letter words. Looked for "
            + csvName + " and " + txtName + (directory != null ? " in " + directory + " and" : "")
            + " on the classpath under " + CLASSPATH_ROOT);
    }

    private static Map<String, Long> parse(BufferedReader reader, String name, int wordLength, String source)
            throws IOException {
        return name.endsWith(".csv")
            ? CorpusReader.readCsv(reader, wordLength, source)
            : CorpusReader.readText(reader, wordLength);
    }
}
