package eu.virtualparadox.docalign.search;

import eu.virtualparadox.docalign.search.distance.Levenshtein;
import eu.virtualparadox.docalign.search.index.NgramIndex;
import eu.virtualparadox.docalign.search.minimizer.Evaluation;
import eu.virtualparadox.docalign.search.minimizer.GreedyMinimumSearch;
import eu.virtualparadox.docalign.search.model.CandidateWindow;
import eu.virtualparadox.docalign.search.model.Match;
import eu.virtualparadox.docalign.text.interval.TextInterval;
import eu.virtualparadox.docalign.text.interval.TextIntervals;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates the substring of a reference text that best approximately matches a short,
 * noisy query.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><strong>Voting:</strong> every trigram of the padded query looks up its occurrences
 *       in the {@link NgramIndex}; each occurrence votes for the query-length window
 *       {@code occurrence / query.length()} it falls into.</li>
 *   <li><strong>Candidate selection:</strong> windows are ranked by votes (ties keep
 *       discovery order). At most {@value #MAX_CANDIDATES} are taken, stopping at the first
 *       one whose votes fall below {@value #DROP_OFF_RATIO} of the previous candidate.</li>
 *   <li><strong>Refinement:</strong> around each candidate, {@link GreedyMinimumSearch}
 *       picks the best query-length start, then stretches start and end by up to a third
 *       of the query length.</li>
 *   <li><strong>Token snapping:</strong> start and end are moved onto the token (or one of
 *       its direct neighbours) closest to the query's first and last token. The center
 *       token is preferred on ties; when repeated words tie, the pairing whose span is
 *       closest to the whole query wins.</li>
 * </ol>
 * The lowest distance over all candidates wins; on equal distance the higher ranked
 * candidate is kept.
 *
 * <h2>Limitations</h2>
 * This is a heuristic. The refinement assumes the edit distance is bowl-shaped around a
 * true match, which may not hold near repeated or near-duplicate phrases, so the result is
 * not guaranteed to be the global minimum.
 *
 * <h2>Thread-safety</h2>
 * The index is built once in the constructor and never modified; one instance may be
 * shared by concurrent callers.
 */
@Slf4j
public final class LevenshteinSearch {

    static final int MAX_CANDIDATES = 10;
    static final double DROP_OFF_RATIO = 0.8;

    /**
     * Votes the first candidate is compared against, low enough to always pass.
     */
    private static final double INITIAL_VOTES = 0.1;

    private final String text;
    private final NgramIndex index;

    public LevenshteinSearch(final String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.index = NgramIndex.build(text);
    }

    public String getText() {
        return text;
    }

    public NgramIndex getIndex() {
        return index;
    }

    /**
     * Searches the whole text.
     *
     * @see #findBest(String, int, int, int)
     */
    public Optional<Match> findBest(final String query) {
        return findBest(query, 0, -1, 0);
    }

    /**
     * Finds the best approximate match of {@code query}.
     *
     * @param query     query string (non-null)
     * @param start     first padded-text offset whose trigrams may vote, {@code >= 0}
     * @param stop      last padded-text offset whose trigrams may vote; negative means
     *                  the end of the text
     * @param threshold advisory distance limit; exceeding it is only logged
     * @return best match, or empty if the query shares no trigram with the searched range
     */
    public Optional<Match> findBest(final String query, final int start, final int stop, final int threshold) {
        Objects.requireNonNull(query, "query must not be null");
        if (start < 0) {
            throw new IllegalArgumentException("start cannot be negative: " + start);
        }
        final int resolvedStop = stop < 0 ? text.length() : stop;
        final int windowSize = query.length();

        Match best = null;
        for (final CandidateWindow candidate : candidateWindows(query, start, resolvedStop)) {
            final int window = candidate.window();
            final int intervalStart = Math.max(start, (int) ((window - 0.5) * windowSize));
            final int intervalStop = Math.min(resolvedStop - windowSize, (int) ((window + 0.5) * windowSize));

            final Match match = findBestInInterval(query, intervalStart, intervalStop);
            log.debug("Window {} ({} votes) refined to {} at distance {}",
                    window, candidate.votes(), match.interval().asString(), match.distance());
            if (best == null || match.distance() < best.distance()) {
                best = match;
            }
        }

        if (best != null && threshold > 0 && best.distance() > threshold) {
            log.debug("Best match for query '{}' has distance {} above threshold {}",
                    query, best.distance(), threshold);
        }
        return Optional.ofNullable(best);
    }

    /**
     * Ranked candidate windows for {@code query}, already cut to the ones
     * {@link #findBest(String, int, int, int)} refines.
     *
     * @param query query string
     * @param start lowest accepted padded-text occurrence
     * @param stop  highest accepted padded-text occurrence
     * @return candidates in refinement order, empty if nothing voted
     */
    public List<CandidateWindow> candidateWindows(final String query, final int start, final int stop) {
        final List<CandidateWindow> result = new ArrayList<>();
        if (query.isEmpty()) {
            return result;
        }

        final int windowSize = query.length();
        final Map<Integer, Integer> votes = new LinkedHashMap<>();
        for (final String ngram : NgramIndex.ngrams(query)) {
            index.occurrences(ngram)
                    .filter(occurrence -> occurrence >= start && occurrence <= stop)
                    .forEach(occurrence -> votes.merge(occurrence / windowSize, 1, Integer::sum));
        }

        final List<Map.Entry<Integer, Integer>> ranked = new ArrayList<>(votes.entrySet());
        // List.sort is stable, equal votes keep discovery order
        ranked.sort(Map.Entry.<Integer, Integer>comparingByValue().reversed());

        double lastVotes = INITIAL_VOTES;
        for (final Map.Entry<Integer, Integer> entry : ranked.subList(0, Math.min(MAX_CANDIDATES, ranked.size()))) {
            final int windowVotes = entry.getValue();
            if (windowVotes / lastVotes < DROP_OFF_RATIO) {
                break;
            }
            lastVotes = windowVotes;
            result.add(new CandidateWindow(entry.getKey(), windowVotes));
        }

        log.debug("Query '{}' voted {} windows, {} retained", query, votes.size(), result.size());
        return result;
    }

    /**
     * Refines a match whose start lies in {@code [start, stop]} (bounds in either order).
     */
    Match findBestInInterval(final String query, final int start, final int stop) {
        final int length = text.length();
        final int queryLength = query.length();

        final TextInterval initial = GreedyMinimumSearch.search(
                TextIntervals.clamp(start, 0, length),
                TextIntervals.clamp(stop, 0, length),
                p -> evaluate(TextIntervals.clamped(p, p + queryLength, length), query)).payload();

        final int radius = queryLength / 3;

        final int fixedEnd = initial.end();
        final TextInterval stretchedStart = GreedyMinimumSearch.search(
                TextIntervals.clamp(initial.start() - radius, 0, fixedEnd),
                TextIntervals.clamp(initial.start() + radius, 0, fixedEnd),
                p -> evaluate(new TextInterval(p, fixedEnd), query)).payload();

        final int fixedStart = stretchedStart.start();
        final TextInterval stretched = GreedyMinimumSearch.search(
                TextIntervals.clamp(stretchedStart.end() - radius, fixedStart, length),
                TextIntervals.clamp(stretchedStart.end() + radius, fixedStart, length),
                p -> evaluate(new TextInterval(fixedStart, p), query)).payload();

        TextInterval firstToken = TextIntervals.tokenInterval(text, stretched.start());
        if (firstToken.isEmpty()) {
            firstToken = TextIntervals.tokenInterval(text, stretched.start() + 1);
        }
        final List<TextInterval> firstTokens =
                closestNeighbourTokens(TextIntervals.firstToken(query).textOf(query), firstToken);

        TextInterval lastToken = TextIntervals.tokenInterval(text, stretched.end() - 1);
        if (lastToken.isEmpty()) {
            lastToken = TextIntervals.tokenInterval(text, stretched.end() - 2);
        }
        final List<TextInterval> lastTokens =
                closestNeighbourTokens(TextIntervals.lastToken(query).textOf(query), lastToken);

        Match best = null;
        for (final TextInterval first : firstTokens) {
            for (final TextInterval last : lastTokens) {
                final TextInterval snapped = first.union(last);
                final int distance = Levenshtein.distance(snapped.textOf(text), query);
                if (best == null || distance < best.distance()) {
                    best = new Match(distance, snapped);
                }
            }
        }
        return best;
    }

    /**
     * Tokens among {@code center} and its two siblings that are closest to
     * {@code queryToken}, in the order center, left sibling, right sibling.
     * More than one token is returned only when they tie, e.g. on repeated words; the
     * caller then keeps the pairing whose span is closest to the whole query.
     */
    private List<TextInterval> closestNeighbourTokens(final String queryToken, final TextInterval center) {
        final TextInterval[] tokens = {
                center,
                TextIntervals.tokenSibling(text, center, -1),
                TextIntervals.tokenSibling(text, center, 1)
        };

        final List<TextInterval> closest = new ArrayList<>(tokens.length);
        int bestDistance = Integer.MAX_VALUE;
        for (final TextInterval token : tokens) {
            final int distance = Levenshtein.distance(token.textOf(text), queryToken);
            if (distance < bestDistance) {
                closest.clear();
                bestDistance = distance;
            }
            if (distance == bestDistance && !closest.contains(token)) {
                closest.add(token);
            }
        }
        return closest;
    }

    private Evaluation<TextInterval> evaluate(final TextInterval interval, final String query) {
        return new Evaluation<>(Levenshtein.distance(interval.textOf(text), query), interval);
    }
}
