package com.jsir.ast;

/**
 * Identifier grammar shared by every consumer of the tree.
 *
 * <p>A valid identifier is non-empty, does not start with a digit, and every following character is
 * a letter, a digit, {@code $} or {@code _}. Letters and digits are classified by
 * {@link Character#isLetterOrDigit(char)}.</p>
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    public static boolean isValid(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        if (Character.isDigit(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isIdentChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws InvalidIdentifierException if {@code name} is not a valid identifier
     */
    public static String requireValid(String name) {
        if (!isValid(name)) {
            throw new InvalidIdentifierException(name);
        }
        return name;
    }

    private static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '$' || c == '_';
    }
}
