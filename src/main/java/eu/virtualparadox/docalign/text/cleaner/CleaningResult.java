package eu.virtualparadox.docalign.text.cleaner;

import eu.virtualparadox.docalign.text.interval.TextInterval;

/**
 * Result of text cleaning: the clean text plus, for every clean character, the offset of
 * the raw character it came from. Offsets are strictly increasing.
 */
public class CleaningResult {
    private final String cleanText;
    private final int[] offsets;

    public CleaningResult(String cleanText, int[] offsets) {
        this.cleanText = cleanText;
        this.offsets = offsets;

        // Verify invariant
        if (cleanText.length() != offsets.length) {
            throw new IllegalStateException(
                    "Cleaning broke the invariant: text length " + cleanText.length() +
                            " != offset table length " + offsets.length
            );
        }
    }

    public String getCleanText() {
        return cleanText;
    }

    public int[] getOffsets() {
        return offsets.clone();
    }

    public int length() {
        return offsets.length;
    }

    /**
     * Maps a clean offset back to the raw text. {@code cleanOffset == length()} maps to the
     * position right after the last kept raw character, so half-open intervals map cleanly.
     *
     * @param cleanOffset offset in {@code [0, length()]}
     * @return offset in the raw text
     * @throws IllegalStateException if {@code cleanOffset} is outside {@code [0, length()]}
     */
    public int getOriginalOffset(final int cleanOffset) {
        if (cleanOffset == offsets.length) {
            return offsets.length == 0 ? 0 : offsets[offsets.length - 1] + 1;
        }
        if (cleanOffset < 0 || cleanOffset > offsets.length) {
            throw new IllegalStateException(
                    "Clean offset " + cleanOffset + " outside of offset table [0, " + offsets.length + "]"
            );
        }
        return offsets[cleanOffset];
    }

    /**
     * Maps both ends of a clean interval through {@link #getOriginalOffset(int)}.
     */
    public TextInterval getOriginalInterval(final TextInterval cleanInterval) {
        return new TextInterval(getOriginalOffset(cleanInterval.start()), getOriginalOffset(cleanInterval.end()));
    }
}
