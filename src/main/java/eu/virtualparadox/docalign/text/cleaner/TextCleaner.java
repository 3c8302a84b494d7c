package eu.virtualparadox.docalign.text.cleaner;

import eu.virtualparadox.docalign.alphabet.CharacterPermission;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class TextCleaner {

    private static final char SPACE = ' ';
    private static final char DASH = '-';

    /**
     * Cleans text with {@link CleaningOptions#DEFAULTS}.
     *
     * @see #clean(String, CharacterPermission, CleaningOptions)
     */
    public CleaningResult clean(final String input, final CharacterPermission permission) {
        return clean(input, permission, CleaningOptions.DEFAULTS);
    }

    /**
     * Cleans raw text in a single left-to-right pass while recording, for every kept
     * character, the raw offset it came from.
     * <p>
     * Per character:
     * <ol>
     *   <li>lower-case it (optional)</li>
     *   <li>turn {@code -} into a space if dashes are not permitted (optional)</li>
     *   <li>turn whitespace into a space, skipping it if a collapsed space was already seen
     *       since the last kept non-whitespace character (optional)</li>
     *   <li>drop it if {@code permission} rejects it</li>
     *   <li>keep it otherwise</li>
     * </ol>
     * Lower-casing works per {@code char}, so the offset table never shifts.
     *
     * @param input      raw text; {@code null} is treated as empty
     * @param permission character-permission oracle
     * @param options    cleaning switches
     * @return clean text with its offset table
     */
    public CleaningResult clean(final String input,
                                final CharacterPermission permission,
                                final CleaningOptions options) {
        Objects.requireNonNull(permission, "permission must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (input == null || input.isEmpty()) {
            return new CleaningResult("", new int[0]);
        }

        final StringBuilder cleaned = new StringBuilder(input.length());
        final int[] offsets = new int[input.length()];
        final boolean dashPermitted = permission.isPermitted(DASH);
        int kept = 0;
        boolean lastWasSpace = false;

        for (int position = 0; position < input.length(); position++) {
            char c = input.charAt(position);
            if (options.lowercase()) {
                c = Character.toLowerCase(c);
            }
            if (options.dashesToSpace() && c == DASH && !dashPermitted) {
                c = SPACE;
            }
            if (options.collapseWhitespace() && Character.isWhitespace(c)) {
                if (lastWasSpace) {
                    continue;
                }
                lastWasSpace = true;
                c = SPACE;
            }
            if (!permission.isPermitted(c)) {
                continue;
            }
            if (!Character.isWhitespace(c)) {
                lastWasSpace = false;
            }
            cleaned.append(c);
            offsets[kept++] = position;
        }

        final int[] offsetTable = new int[kept];
        System.arraycopy(offsets, 0, offsetTable, 0, kept);
        return new CleaningResult(cleaned.toString(), offsetTable);
    }
}
