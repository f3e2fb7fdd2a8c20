package com.example.dataflow.core.processor;

import com.example.dataflow.core.exception.InvalidIdentifierException;

import java.util.regex.Pattern;

/**
 * Allow-list check for table names that end up unescaped in generated SQL.
 */
public final class SqlIdentifiers {

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]+$");

    private SqlIdentifiers() {
    }

    /**
     * @throws InvalidIdentifierException if the name is empty or has characters other than
     *                                    letters, digits and underscore.
     */
    public static String requireSafe(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new InvalidIdentifierException("invalid table name: empty identifier");
        }
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new InvalidIdentifierException("invalid table name: identifier contains invalid characters (allowed: A-Z a-z 0-9 _)");
        }
        return identifier;
    }

    /**
     * Double-quotes a column name, doubling embedded quotes.
     */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
