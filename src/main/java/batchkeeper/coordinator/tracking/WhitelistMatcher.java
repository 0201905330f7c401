package batchkeeper.coordinator.tracking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fuzzy whitelist: a line is benign when it shares at least {@code threshold}
 * distinct words with one of the entries. Lines carry varying parameters, so
 * exact matching would miss most repeats of a known warning.
 */
public final class WhitelistMatcher {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}_]+");

    private final List<Set<String>> entries;
    private final int threshold;
    private final boolean caseSensitive;

    public WhitelistMatcher(List<String> entries, int threshold, boolean caseSensitive) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, got " + threshold);
        }
        this.threshold = threshold;
        this.caseSensitive = caseSensitive;
        List<Set<String>> sets = new ArrayList<>();
        for (String entry : entries) {
            Set<String> words = words(entry, caseSensitive);
            if (!words.isEmpty()) {
                sets.add(words);
            }
        }
        this.entries = List.copyOf(sets);
    }

    public boolean matches(String line) {
        if (entries.isEmpty()) {
            return false;
        }
        Set<String> lineWords = words(line, caseSensitive);
        for (Set<String> entry : entries) {
            int shared = 0;
            for (String word : entry) {
                if (lineWords.contains(word) && ++shared >= threshold) {
                    return true;
                }
            }
        }
        return false;
    }

    static Set<String> words(String text, boolean caseSensitive) {
        String source = caseSensitive ? text : text.toLowerCase(Locale.ROOT);
        Set<String> words = new HashSet<>(Arrays.asList(WORD_SEPARATOR.split(source)));
        words.remove("");
        return words;
    }
}
