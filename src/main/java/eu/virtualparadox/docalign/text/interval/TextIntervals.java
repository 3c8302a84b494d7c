package eu.virtualparadox.docalign.text.interval;

import java.util.Objects;

/**
 * Token-level interval helpers. A token is a maximal run of non-whitespace characters.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Positions outside the text or on whitespace yield an empty interval at that
 *       position, clamped into {@code [0, text.length()]}.</li>
 *   <li>Sibling lookup assumes tokens are separated by a single space, which holds for
 *       whitespace-collapsed text.</li>
 * </ul>
 */
public final class TextIntervals {

    private TextIntervals() {
        // prevent instantiation
    }

    /**
     * The token covering position {@code at}.
     *
     * @param text text to inspect (non-null)
     * @param at   probe position, may lie outside the text
     * @return maximal non-whitespace run containing {@code at}, or an empty interval
     */
    public static TextInterval tokenInterval(final CharSequence text, final int at) {
        Objects.requireNonNull(text, "text must not be null");
        final int length = text.length();
        if (at < 0 || at >= length || Character.isWhitespace(text.charAt(at))) {
            return TextInterval.empty(clamp(at, 0, length));
        }

        int start = at;
        while (start > 0 && !Character.isWhitespace(text.charAt(start - 1))) {
            start--;
        }
        int end = at + 1;
        while (end < length && !Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return new TextInterval(start, end);
    }

    /**
     * The token right before ({@code direction < 0}) or right after ({@code direction > 0})
     * the given token, probing past the single separating space.
     *
     * @param text      text to inspect
     * @param token     interval of the reference token
     * @param direction sign selects the neighbour
     * @return neighbouring token or an empty interval when there is none
     */
    public static TextInterval tokenSibling(final CharSequence text,
                                            final TextInterval token,
                                            final int direction) {
        return tokenInterval(text, direction < 0 ? token.start() - 2 : token.end() + 1);
    }

    /**
     * First token of {@code text}, skipping leading whitespace.
     */
    public static TextInterval firstToken(final CharSequence text) {
        int at = 0;
        while (at < text.length() && Character.isWhitespace(text.charAt(at))) {
            at++;
        }
        return tokenInterval(text, at);
    }

    /**
     * Last token of {@code text}, skipping trailing whitespace.
     */
    public static TextInterval lastToken(final CharSequence text) {
        int at = text.length() - 1;
        while (at >= 0 && Character.isWhitespace(text.charAt(at))) {
            at--;
        }
        return tokenInterval(text, at);
    }

    /**
     * Interval {@code [start, end)} clamped into {@code [0, length]}; an end before the
     * start collapses to an empty interval at the start.
     */
    public static TextInterval clamped(final int start, final int end, final int length) {
        final int s = clamp(start, 0, length);
        final int e = clamp(end, 0, length);
        return new TextInterval(s, Math.max(s, e));
    }

    public static int clamp(final int value, final int min, final int max) {
        return Math.max(min, Math.min(max, value));
    }
}
