package com.metadata.disambiguation.graph;

import java.util.regex.Pattern;

/**
 * Input validation for values that end up in Cypher text.
 * Labels and property names are interpolated into queries and must be plain identifiers;
 * everything else is bound as a parameter.
 */
public final class InputSanitizer {

    /** Maximum allowed length for Cypher string values. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a label or property name for interpolation into a query.
     * Only alphanumeric characters and underscores are allowed, and it may not start with a digit.
     *
     * @param identifier the label or property name
     * @throws IllegalArgumentException if the identifier is invalid
     */
    public static String validateIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be null or blank");
        }
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(
                    "Identifier must contain only alphanumeric characters and underscores, " +
                            "got: '" + identifier + "'");
        }
        return identifier;
    }

    /**
     * Validates a string value for safe use in Cypher queries.
     * Enforces maximum length to prevent oversized payloads.
     *
     * @param value the string value to sanitize
     * @throws IllegalArgumentException if the value exceeds the maximum length
     */
    public static void sanitizeForCypher(String value) {
        if (!isWithinCypherLimit(value)) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }

    /**
     * Returns true if the value can be bound into a query; null always can.
     */
    public static boolean isWithinCypherLimit(String value) {
        return value == null || value.length() <= MAX_CYPHER_VALUE_LENGTH;
    }
}
