package eu.virtualparadox.docalign.alphabet;

/**
 * Raised when text contains a character the alphabet has no label for.
 */
public class UnknownCharacterException extends IllegalArgumentException {

    private final String character;

    public UnknownCharacterException(final String character, final String alphabetSource) {
        super("Your transcripts contain the character '" + character + "' which does not occur in "
                + alphabetSource + ". Add all characters used by your transcripts to the alphabet file.");
        this.character = character;
    }

    public String getCharacter() {
        return character;
    }
}
