package eu.virtualparadox.docalign.search.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Trigram occurrence index over a text padded with one leading and one trailing space.
 * <p>
 * Every 3-character window of the padded text is recorded under its trigram, keeping the
 * start offsets (into the padded text) in discovery order. The index is built in one pass
 * and read-only afterwards, so it can be shared between threads without locking.
 * </p>
 */
public final class NgramIndex {

    /**
     * Length of the indexed n-grams.
     */
    public static final int SIZE = 3;

    private static final int[] NO_OCCURRENCES = new int[0];

    private final Map<String, int[]> occurrences;

    private NgramIndex(final Map<String, int[]> occurrences) {
        this.occurrences = occurrences;
    }

    /**
     * Builds the index in {@code O(n)}.
     *
     * @param text text to index (non-null)
     * @return immutable index
     */
    public static NgramIndex build(final CharSequence text) {
        Objects.requireNonNull(text, "text must not be null");
        final Map<String, List<Integer>> buckets = new HashMap<>();
        final List<String> grams = ngrams(text);
        for (int i = 0; i < grams.size(); i++) {
            buckets.computeIfAbsent(grams.get(i), k -> new ArrayList<>()).add(i);
        }

        final Map<String, int[]> frozen = new HashMap<>(buckets.size() * 2);
        for (final Map.Entry<String, List<Integer>> entry : buckets.entrySet()) {
            frozen.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
        }
        return new NgramIndex(Collections.unmodifiableMap(frozen));
    }

    /**
     * Trigrams of {@code text} padded with a space on both sides, in order. The trigram at
     * list index {@code i} starts at padded offset {@code i}.
     */
    public static List<String> ngrams(final CharSequence text) {
        final String padded = " " + text + " ";
        final int count = Math.max(0, padded.length() - SIZE + 1);
        final List<String> grams = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            grams.add(padded.substring(i, i + SIZE));
        }
        return grams;
    }

    /**
     * Padded-text start offsets of {@code ngram}, in discovery order.
     */
    public IntStream occurrences(final String ngram) {
        return IntStream.of(occurrences.getOrDefault(ngram, NO_OCCURRENCES));
    }

    /**
     * Number of distinct n-grams.
     */
    public int size() {
        return occurrences.size();
    }
}
