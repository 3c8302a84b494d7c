package eu.virtualparadox.docalign.search.model;

import eu.virtualparadox.docalign.text.interval.TextInterval;

/**
 * Best approximate match of a query inside a reference text.
 *
 * @param distance edit distance between the query and the covered text
 * @param interval matched interval of the reference text
 */
public record Match(int distance, TextInterval interval) {

    public Match {
        if (distance < 0) {
            throw new IllegalArgumentException("distance cannot be negative: " + distance);
        }
    }
}
