package eu.virtualparadox.docalign.alphabet;

/**
 * Decides whether a character may appear in cleaned text.
 */
@FunctionalInterface
public interface CharacterPermission {

    /**
     * @param c candidate character
     * @return {@code true} if {@code c} belongs to the permitted set
     */
    boolean isPermitted(char c);

    /**
     * Permission accepting every character.
     */
    static CharacterPermission all() {
        return c -> true;
    }
}
