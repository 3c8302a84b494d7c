package eu.virtualparadox.docalign.search.model;

/**
 * Query-length slice of the reference text and the number of query trigrams voting for it.
 *
 * @param window slice index, i.e. {@code paddedOffset / query.length()}
 * @param votes  shared trigram occurrences falling into the slice
 */
public record CandidateWindow(int window, int votes) {

}
