package eu.virtualparadox.docalign.text.interval;

/**
 * Half-open character interval {@code [start, end)} over some text.
 * {@code start == end} denotes the empty interval at {@code start}.
 *
 * @param start inclusive start offset, {@code >= 0}
 * @param end   exclusive end offset, {@code >= start}
 */
public record TextInterval(int start, int end) {

    public TextInterval {
        if (start < 0) {
            throw new IllegalArgumentException("Invalid interval: start (" + start + ") cannot be negative");
        }
        if (start > end) {
            throw new IllegalArgumentException(
                    "Invalid interval: start (" + start + ") cannot be greater than end (" + end + ")"
            );
        }
    }

    public static TextInterval empty(final int at) {
        return new TextInterval(at, at);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Smallest interval containing both this and {@code other}.
     */
    public TextInterval union(final TextInterval other) {
        return new TextInterval(Math.min(start, other.start), Math.max(end, other.end));
    }

    /**
     * The characters of {@code text} covered by this interval.
     *
     * @throws IndexOutOfBoundsException if the interval exceeds the text
     */
    public String textOf(final CharSequence text) {
        return text.subSequence(start, end).toString();
    }

    public String asString() {
        return "[" + start + ", " + end + ")";
    }
}
