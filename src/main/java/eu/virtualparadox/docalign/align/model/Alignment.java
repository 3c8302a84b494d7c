package eu.virtualparadox.docalign.align.model;

import eu.virtualparadox.docalign.text.interval.TextInterval;

/**
 * A query located inside a reference document.
 *
 * @param query            query as given by the caller
 * @param cleanInterval    match interval over the clean reference text
 * @param originalInterval match interval over the original reference text
 * @param originalText     original reference text covered by the match
 * @param distance         edit distance between the clean query and the clean match
 */
public record Alignment(String query,
                        TextInterval cleanInterval,
                        TextInterval originalInterval,
                        String originalText,
                        int distance) {

}
