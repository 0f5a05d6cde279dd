package com.wordlearena.lexicon;

import java.io.BufferedReader;
import java.io.IOException;
import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the two corpus formats into word counts.
 *
 * <ul>
 *   <li>CSV with a {@code word,count} header; rows with count &lt;= 0 are dropped.</li>
 *   <li>Plain text, one word per line; every count is 1.</li>
 * </ul>
 * Words are lower-cased and stripped of accents before the {@code [a-z]{n}}
 * check. The first occurrence of a word wins.
 */
final class CorpusReader {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");

    private CorpusReader() {}

    static String normalize(String raw) {
        String lower = raw.strip().toLowerCase(Locale.ROOT);
        return COMBINING_MARKS.matcher(Normalizer.normalize(lower, Normalizer.Form.NFKD)).replaceAll("");
    }

    static Map<String, Long> readText(BufferedReader reader, int wordLength) throws IOException {
        Pattern valid = wordPattern(wordLength);
        Map<String, Long> counts = new LinkedHashMap<>();
        String line;
        while ((line = reader.readLine()) != null) {
            String w = normalize(line);
            if (!w.isEmpty() && valid.matcher(w).matches()) {
                counts.putIfAbsent(w, 1L);
            }
        }
        return counts;
    }

    static Map<String, Long> readCsv(BufferedReader reader, int wordLength, String source) throws IOException {
        String header = reader.readLine();
        if (header == null) return new LinkedHashMap<>();

        String[] columns = header.strip().split(",");
        int wordIdx  = indexOf(columns, "word");
        int countIdx = indexOf(columns, "count");
        if (wordIdx < 0 || countIdx < 0) {
            throw new LexiconException("CSV corpus " + source + " must have a 'word,count' header, got: " + header);
        }

        Pattern valid = wordPattern(wordLength);
        Map<String, Long> counts = new LinkedHashMap<>();
        String line;
        int lineNo = 1;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;
            String[] cells = line.split(",", -1);
            if (cells.length <= Math.max(wordIdx, countIdx)) {
                throw new LexiconException("Malformed row in " + source + " at line " + lineNo + ": " + line);
            }
            String w = normalize(cells[wordIdx]);
            if (w.isEmpty() || counts.containsKey(w) || !valid.matcher(w).matches()) continue;

            long c;
            try {
                c = Long.parseLong(cells[countIdx].strip());
            } catch (NumberFormatException e) {
                throw new LexiconException("Invalid count in " + source + " at line " + lineNo + ": " + line, e);
            }
            if (c <= 0) continue;
            counts.put(w, c);
        }
        return counts;
    }

    private static Pattern wordPattern(int wordLength) {
        return Pattern.compile("[a-z]{" + wordLength + "}");
    }

    private static int indexOf(String[] columns, String name) {
        for (int i = 0; i < columns.length; i++) {
            if (columns[i].strip().equalsIgnoreCase(name)) return i;
        }
        return -1;
    }
}
