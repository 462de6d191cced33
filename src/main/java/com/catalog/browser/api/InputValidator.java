package com.catalog.browser.api;

/**
 * Validation of caller-supplied query strings and catalog ids.
 */
public final class InputValidator {

    /** Maximum allowed length for search queries. */
    public static final int MAX_QUERY_LENGTH = 1000;

    /** Maximum allowed length for catalog ids. */
    public static final int MAX_ID_LENGTH = 64;

    private InputValidator() {
        // utility class
    }

    /**
     * Validates a search query. Field filters such as {@code artist:Beatles} are allowed.
     *
     * @throws IllegalArgumentException if the query is blank, too long or contains control characters
     */
    public static void validateQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be null or blank");
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new IllegalArgumentException(
                    "Query exceeds maximum length of " + MAX_QUERY_LENGTH +
                            " characters (was " + query.length() + ")");
        }
        if (containsControlCharacters(query)) {
            throw new IllegalArgumentException("Query must not contain control characters");
        }
    }

    /**
     * Validates a catalog id. Ids are opaque, case-sensitive alphanumeric strings.
     *
     * @throws IllegalArgumentException if the id is blank, too long or not alphanumeric
     */
    public static void validateId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Id must not be null or blank");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "Id exceeds maximum length of " + MAX_ID_LENGTH + " characters (was " + id.length() + ")");
        }
        if (!id.matches("^[A-Za-z0-9]+$")) {
            throw new IllegalArgumentException("Id must contain only letters and digits, got: '" + id + "'");
        }
    }

    // tab, newline and carriage return are allowed
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
