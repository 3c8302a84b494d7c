package eu.virtualparadox.docalign.text.cleaner;

/**
 * Switches controlling {@link TextCleaner}.
 *
 * @param lowercase          lower-case every character before any other rule
 * @param collapseWhitespace turn whitespace runs into a single space
 * @param dashesToSpace      treat {@code -} as a space unless the alphabet permits it
 */
public record CleaningOptions(boolean lowercase, boolean collapseWhitespace, boolean dashesToSpace) {

    public static final CleaningOptions DEFAULTS = new CleaningOptions(true, true, true);
}
