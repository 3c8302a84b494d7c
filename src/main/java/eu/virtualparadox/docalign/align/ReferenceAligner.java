package eu.virtualparadox.docalign.align;

import eu.virtualparadox.docalign.align.model.Alignment;
import eu.virtualparadox.docalign.align.model.ReferenceDocument;
import eu.virtualparadox.docalign.alphabet.Alphabet;
import eu.virtualparadox.docalign.application.config.ApplicationConfig;
import eu.virtualparadox.docalign.search.model.Match;
import eu.virtualparadox.docalign.text.cleaner.CleaningResult;
import eu.virtualparadox.docalign.text.cleaner.TextCleaner;
import eu.virtualparadox.docalign.text.interval.TextInterval;
import eu.virtualparadox.docalign.util.concurrent.LimitingPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aligns transcript fragments against reference texts.
 * <ol>
 *   <li>{@link #prepare(String)} cleans the reference with the configured alphabet and
 *       builds its trigram index once.</li>
 *   <li>{@link #align(ReferenceDocument, String)} cleans the query the same way, locates it
 *       in the clean reference and maps the result back to original offsets.</li>
 * </ol>
 * Prepared documents are immutable, so any number of alignments may run against one
 * document concurrently; {@link #alignAll(ReferenceDocument, List)} does so on the
 * application's {@link LimitingPool}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReferenceAligner {

    private final TextCleaner textCleaner;
    private final Alphabet alphabet;
    private final ApplicationConfig config;
    private final LimitingPool alignmentPool;

    public ReferenceDocument prepare(final String originalText) {
        Objects.requireNonNull(originalText, "originalText must not be null");
        final CleaningResult cleaning = textCleaner.clean(originalText, alphabet, config.getCleaningOptions());
        final ReferenceDocument document = new ReferenceDocument(originalText, cleaning);
        log.info("Prepared reference of {} characters ({} clean, {} distinct trigrams)",
                originalText.length(), cleaning.length(), document.getSearch().getIndex().size());
        return document;
    }

    public Optional<Alignment> align(final ReferenceDocument document, final String query) {
        return align(document, query, 0, -1, 0);
    }

    /**
     * Locates {@code query} in {@code document}.
     *
     * @param document  prepared reference
     * @param query     raw query text
     * @param start     lower bound of the searched clean range
     * @param stop      upper bound of the searched clean range, negative for the end
     * @param threshold advisory distance limit
     * @return the alignment, or empty if the clean query is empty or nothing matched
     */
    public Optional<Alignment> align(final ReferenceDocument document,
                                     final String query,
                                     final int start,
                                     final int stop,
                                     final int threshold) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(query, "query must not be null");

        final String cleanQuery = textCleaner.clean(query, alphabet, config.getCleaningOptions()).getCleanText();
        if (cleanQuery.isBlank()) {
            log.debug("Query '{}' is empty after cleaning", query);
            return Optional.empty();
        }

        final Optional<Match> match = document.getSearch().findBest(cleanQuery, start, stop, threshold);
        if (match.isEmpty()) {
            log.debug("No candidate window for query '{}'", cleanQuery);
            return Optional.empty();
        }

        final TextInterval cleanInterval = match.get().interval();
        final TextInterval originalInterval = document.toOriginal(cleanInterval);
        return Optional.of(new Alignment(
                query,
                cleanInterval,
                originalInterval,
                originalInterval.textOf(document.getOriginalText()),
                match.get().distance()));
    }

    /**
     * Aligns every query against {@code document} in parallel.
     *
     * @return one entry per query, in query order
     */
    public List<Optional<Alignment>> alignAll(final ReferenceDocument document, final List<String> queries) {
        Objects.requireNonNull(queries, "queries must not be null");
        final List<Optional<Alignment>> result = new ArrayList<>(queries.size());
        final Iterator<Optional<Alignment>> alignments =
                alignmentPool.map(query -> align(document, query), queries.iterator());
        try {
            while (alignments.hasNext()) {
                result.add(alignments.next());
            }
        } catch (RuntimeException e) {
            log.error("Batch alignment failed after {} of {} queries", result.size(), queries.size(), e);
            throw e;
        }
        log.info("Aligned {} queries, {} matched", queries.size(),
                result.stream().filter(Optional::isPresent).count());
        return result;
    }
}
