package eu.virtualparadox.docalign.align.model;

import eu.virtualparadox.docalign.search.LevenshteinSearch;
import eu.virtualparadox.docalign.text.cleaner.CleaningResult;
import eu.virtualparadox.docalign.text.interval.TextInterval;

/**
 * Reference text prepared for alignment: the original, its clean form with offset table,
 * and the search index over the clean form. Immutable once built.
 */
public final class ReferenceDocument {

    private final String originalText;
    private final CleaningResult cleaning;
    private final LevenshteinSearch search;

    public ReferenceDocument(final String originalText, final CleaningResult cleaning) {
        this.originalText = originalText;
        this.cleaning = cleaning;
        this.search = new LevenshteinSearch(cleaning.getCleanText());
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getCleanText() {
        return cleaning.getCleanText();
    }

    public CleaningResult getCleaning() {
        return cleaning;
    }

    public LevenshteinSearch getSearch() {
        return search;
    }

    public TextInterval toOriginal(final TextInterval cleanInterval) {
        return cleaning.getOriginalInterval(cleanInterval);
    }
}
