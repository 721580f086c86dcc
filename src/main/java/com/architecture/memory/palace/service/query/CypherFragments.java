package com.architecture.memory.palace.service.query;

import java.util.regex.Pattern;

/**
 * Guards for the only pieces of query text that are not parameters: identifiers
 * (aliases, labels, property keys, relationship types) and projection templates.
 *
 * Identifiers are restricted to {@code [A-Za-z_][A-Za-z0-9_]*}; they are never quoted
 * or escaped, they are rejected.
 */
public final class CypherFragments {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // db.index.vector.queryNodes and similar
    private static final Pattern PROCEDURE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    // Quotes would allow inline literals, '$' would reference parameters the bag does not own
    private static final Pattern FORBIDDEN_IN_TEMPLATE = Pattern.compile("['\"`$;\\\\]|//|/\\*|\\*/");

    private CypherFragments() {
    }

    public static boolean isIdentifier(String candidate) {
        return candidate != null && IDENTIFIER.matcher(candidate).matches();
    }

    public static String requireIdentifier(String candidate, String role) {
        if (!isIdentifier(candidate)) {
            throw new IllegalArgumentException(String.format("Invalid %s identifier: '%s'", role, candidate));
        }
        return candidate;
    }

    public static String requireProcedure(String candidate) {
        if (candidate == null || !PROCEDURE.matcher(candidate).matches()) {
            throw new IllegalArgumentException(String.format("Invalid procedure name: '%s'", candidate));
        }
        return candidate;
    }

    /**
     * Qualified property reference, e.g. {@code m.salience}.
     */
    public static String property(String alias, String field) {
        return requireIdentifier(alias, "alias") + "." + requireIdentifier(field, "property");
    }

    /**
     * Validates a projection, return or ordering item written by application code.
     */
    public static String requireTemplate(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            throw new IllegalArgumentException("Query fragment must not be blank");
        }
        if (FORBIDDEN_IN_TEMPLATE.matcher(fragment).find()) {
            throw new IllegalArgumentException(String.format(
                    "Query fragment may not contain literals, parameters or comments: '%s'", fragment));
        }
        return fragment.trim();
    }
}
