package eu.virtualparadox.docalign.alphabet;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of labels loaded from an alphabet file.
 *
 * <h2>File format</h2>
 * <ul>
 *   <li>One label per line; the label index is its position among the label lines.</li>
 *   <li>Lines starting with {@code #} are comments.</li>
 *   <li>A line consisting of {@code \#} declares the literal {@code #} label.</li>
 *   <li>Empty lines are ignored. A line holding a single space declares the space label.</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
@Slf4j
public final class Alphabet implements CharacterPermission {

    private static final String COMMENT = "#";
    private static final String ESCAPED_COMMENT = "\\#";

    private final String source;
    private final List<String> labelToString;
    private final Map<String, Integer> stringToLabel;

    private Alphabet(final String source, final List<String> labels) {
        this.source = source;
        this.labelToString = Collections.unmodifiableList(new ArrayList<>(labels));
        final Map<String, Integer> index = new HashMap<>();
        for (int label = 0; label < labels.size(); label++) {
            index.putIfAbsent(labels.get(label), label);
        }
        this.stringToLabel = Collections.unmodifiableMap(index);
    }

    /**
     * Parses alphabet lines (without line terminators).
     *
     * @param source human readable origin, used in error messages
     * @param lines  raw lines of the alphabet file
     * @return parsed alphabet
     */
    public static Alphabet fromLines(final String source, final List<String> lines) {
        Objects.requireNonNull(lines, "lines must not be null");
        final List<String> labels = new ArrayList<>();
        for (final String line : lines) {
            if (StringUtils.isEmpty(line)) {
                continue;
            }
            if (ESCAPED_COMMENT.equals(line)) {
                labels.add(COMMENT);
            } else if (!line.startsWith(COMMENT)) {
                labels.add(line);
            }
        }
        log.debug("Parsed {} labels from {}", labels.size(), source);
        return new Alphabet(source, labels);
    }

    /**
     * Reads a UTF-8 alphabet file from {@code in}. The stream is not closed.
     */
    public static Alphabet read(final String source, final InputStream in) throws IOException {
        final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        final List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return fromLines(source, lines);
    }

    /**
     * Loads an alphabet from a Spring {@link Resource}.
     *
     * @throws IOException if the resource is missing or unreadable
     */
    public static Alphabet load(final Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return read(resource.getDescription(), in);
        }
    }

    @Override
    public boolean isPermitted(final char c) {
        return hasLabel(String.valueOf(c));
    }

    public boolean hasLabel(final String string) {
        return stringToLabel.containsKey(string);
    }

    /**
     * @throws UnknownCharacterException if {@code string} is not a label of this alphabet
     */
    public int labelFromString(final String string) {
        final Integer label = stringToLabel.get(string);
        if (label == null) {
            throw new UnknownCharacterException(string, source);
        }
        return label;
    }

    public String stringFromLabel(final int label) {
        return labelToString.get(label);
    }

    /**
     * Maps every character of {@code text} to its label.
     *
     * @throws UnknownCharacterException on the first character without a label
     */
    public int[] encode(final CharSequence text) {
        final int[] labels = new int[text.length()];
        for (int i = 0; i < text.length(); i++) {
            labels[i] = labelFromString(String.valueOf(text.charAt(i)));
        }
        return labels;
    }

    public String decode(final int[] labels) {
        final StringBuilder sb = new StringBuilder();
        for (final int label : labels) {
            sb.append(stringFromLabel(label));
        }
        return sb.toString();
    }

    public int size() {
        return labelToString.size();
    }

    public String getSource() {
        return source;
    }
}
