package eu.virtualparadox.docalign.text.cleaner;

import eu.virtualparadox.docalign.alphabet.CharacterPermission;
import eu.virtualparadox.docalign.text.interval.TextInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TextCleaner}.
 *
 * These tests cover lower-casing, dash handling, whitespace collapsing, character
 * filtering and the offset table mapping clean positions back to the raw text.
 */
class TextCleanerTest {

    private static final CharacterPermission LETTERS_AND_SPACE =
            c -> c == ' ' || (c >= 'a' && c <= 'z');

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    @DisplayName("Dashes collapse into one space, punctuation is dropped")
    void testDashesAndPunctuation() {
        CleaningResult result = cleaner.clean("Hello---World!!", LETTERS_AND_SPACE);

        assertThat(result.getCleanText()).isEqualTo("hello world");
        assertThat(result.getOffsets()).containsExactly(0, 1, 2, 3, 4, 5, 8, 9, 10, 11, 12);
        assertThat(result.getOriginalOffset(11)).isEqualTo(13);
    }

    @Test
    void testWhitespaceRunsBecomeSingleSpace() {
        CleaningResult result = cleaner.clean("Foo\t\n  Bar", LETTERS_AND_SPACE);

        assertThat(result.getCleanText()).isEqualTo("foo bar");
        assertThat(result.getOffsets()).containsExactly(0, 1, 2, 3, 7, 8, 9);
    }

    @Test
    void testSpacedDash() {
        CleaningResult result = cleaner.clean("a - b", LETTERS_AND_SPACE);

        assertThat(result.getCleanText()).isEqualTo("a b");
        assertThat(result.getOffsets()).containsExactly(0, 1, 4);
    }

    @Test
    void testPermittedDashIsKept() {
        CharacterPermission withDash = c -> c == '-' || LETTERS_AND_SPACE.isPermitted(c);
        CleaningResult result = cleaner.clean("well-known  fact", withDash);

        assertThat(result.getCleanText()).isEqualTo("well-known fact");
        assertThat(result.getOffsets()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 12, 13, 14, 15);
    }

    @Test
    void testCollapsingCanBeDisabled() {
        CleaningResult result = cleaner.clean("Foo  Bar", LETTERS_AND_SPACE,
                new CleaningOptions(true, false, true));

        assertThat(result.getCleanText()).isEqualTo("foo  bar");
    }

    @Test
    void testLowercasingCanBeDisabled() {
        CleaningResult result = cleaner.clean("ABC def", LETTERS_AND_SPACE,
                new CleaningOptions(false, true, true));

        assertThat(result.getCleanText()).isEqualTo(" def");
        assertThat(result.getOffsets()).containsExactly(3, 4, 5, 6);
    }

    @Test
    @DisplayName("Unpermitted spaces are dropped without breaking later words")
    void testSpaceNotPermitted() {
        CleaningResult result = cleaner.clean("a  b", c -> c == 'a' || c == 'b');

        assertThat(result.getCleanText()).isEqualTo("ab");
        assertThat(result.getOffsets()).containsExactly(0, 3);
    }

    @Test
    void testNullAndEmptyInput() {
        assertThat(cleaner.clean(null, LETTERS_AND_SPACE).getCleanText()).isEmpty();
        CleaningResult empty = cleaner.clean("", LETTERS_AND_SPACE);
        assertThat(empty.length()).isZero();
        assertThat(empty.getOriginalOffset(0)).isZero();
    }

    @Test
    @DisplayName("Permissive oracle: offsets point at the kept raw characters")
    void testOffsetRoundTrip() {
        String raw = "One  two\tthree --four";
        CleaningResult result = cleaner.clean(raw, CharacterPermission.all(),
                new CleaningOptions(false, true, false));

        String clean = result.getCleanText();
        assertThat(clean).isEqualTo("One two\tthree --four".replace('\t', ' '));
        for (int k = 0; k < clean.length(); k++) {
            int original = result.getOriginalOffset(k);
            char expected = Character.isWhitespace(raw.charAt(original)) ? ' ' : raw.charAt(original);
            assertThat(clean.charAt(k)).isEqualTo(expected);
        }
        assertThat(result.getOriginalOffset(clean.length())).isEqualTo(raw.length());
    }

    @Test
    void testOffsetsAreStrictlyIncreasing() {
        int[] offsets = cleaner.clean("  It's   a -- test, OK?\n", LETTERS_AND_SPACE).getOffsets();
        for (int i = 1; i < offsets.length; i++) {
            assertThat(offsets[i]).isGreaterThan(offsets[i - 1]);
        }
    }

    @Test
    @DisplayName("Cleaning clean text is the identity")
    void testIdempotence() {
        CleaningResult first = cleaner.clean("  Some -- RAW\ttext, with   noise!  ", LETTERS_AND_SPACE);
        CleaningResult second = cleaner.clean(first.getCleanText(), LETTERS_AND_SPACE);

        assertThat(second.getCleanText()).isEqualTo(first.getCleanText());
        for (int k = 0; k < second.length(); k++) {
            assertThat(second.getOriginalOffset(k)).isEqualTo(k);
        }
    }

    @Test
    void testOriginalInterval() {
        CleaningResult result = cleaner.clean("Hello---World!!", LETTERS_AND_SPACE);

        assertThat(result.getOriginalInterval(new TextInterval(6, 11))).isEqualTo(new TextInterval(8, 13));
        assertThat(result.getOriginalInterval(new TextInterval(0, 5))).isEqualTo(new TextInterval(0, 5));
    }

    @Test
    void testOffsetOutOfRangeFailsLoudly() {
        CleaningResult result = cleaner.clean("abc", LETTERS_AND_SPACE);

        assertThatThrownBy(() -> result.getOriginalOffset(4)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> result.getOriginalOffset(-1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testInvariantIsVerified() {
        assertThatThrownBy(() -> new CleaningResult("abc", new int[]{0, 1}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("invariant");
    }
}
