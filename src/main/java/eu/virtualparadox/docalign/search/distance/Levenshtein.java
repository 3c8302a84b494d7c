package eu.virtualparadox.docalign.search.distance;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.Objects;

/**
 * Exact Levenshtein (edit) distance, backed by commons-text.
 * <p>
 * The unlimited {@link LevenshteinDistance} instance runs in {@code O(n * m)} time and keeps
 * a single row sized after the shorter input, so auxiliary space is {@code O(min(n, m))}.
 * </p>
 */
public final class Levenshtein {

    private static final LevenshteinDistance DISTANCE = LevenshteinDistance.getDefaultInstance();

    private Levenshtein() {
        // prevent instantiation
    }

    /**
     * Minimum number of single-character insertions, deletions and substitutions
     * turning {@code a} into {@code b}.
     *
     * @param a first sequence (non-null)
     * @param b second sequence (non-null)
     * @return edit distance, {@code b.length()} if {@code a} is empty and vice versa
     */
    public static int distance(final CharSequence a, final CharSequence b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        return DISTANCE.apply(a, b);
    }
}
