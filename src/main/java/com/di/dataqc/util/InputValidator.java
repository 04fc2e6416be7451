package com.di.dataqc.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Input validation for user-supplied queries, connection parameters and file names.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Patterns
    // ============================================================================

    /**
     * Statements that modify data or schema. A read-only query must contain none of them as a word.
     */
    private static final Pattern DANGEROUS_STATEMENT_PATTERN = Pattern.compile(
            "\\b(DROP|DELETE|TRUNCATE|ALTER|CREATE|INSERT|UPDATE|GRANT|REVOKE)\\s+",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Valid PostgreSQL identifier (database name): letter or underscore, then letters, digits,
     * underscores or dollar signs; 63 characters at most.
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$-]{0,62}$"
    );

    /** Host name or IPv4/IPv6 literal. */
    private static final Pattern VALID_HOST_PATTERN = Pattern.compile("^[a-zA-Z0-9.:\\[\\]-]{1,253}$");

    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[<>:\"|?*]");

    private static final int MAX_FILENAME_LENGTH = 200;

    // ============================================================================
    // SQL
    // ============================================================================

    /**
     * Accepts a single read-only {@code SELECT} (or {@code WITH ... SELECT}) statement.
     * A trailing semicolon is dropped; any other semicolon is rejected.
     *
     * @return the trimmed query without trailing semicolon
     * @throws IllegalArgumentException when the query is empty, not a SELECT, contains a modifying
     *                                  statement, or holds more than one statement
     */
    public static String validateSelectQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        String trimmed = query.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        if (trimmed.contains(";")) {
            log.warn("Rejected multi-statement query: {}", abbreviate(trimmed));
            throw new IllegalArgumentException("Only a single statement is allowed");
        }
        Matcher dangerous = DANGEROUS_STATEMENT_PATTERN.matcher(trimmed);
        if (dangerous.find()) {
            log.warn("Rejected query with {} statement: {}", dangerous.group(1).toUpperCase(Locale.ROOT), abbreviate(trimmed));
            throw new IllegalArgumentException(
                    "Dangerous operation detected: " + dangerous.group(1).toUpperCase(Locale.ROOT));
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (!upper.startsWith("SELECT") && !upper.startsWith("WITH")) {
            throw new IllegalArgumentException("Only SELECT queries are allowed");
        }
        return trimmed;
    }

    /**
     * @throws IllegalArgumentException if the database name is not a plain identifier
     */
    public static String validateDatabaseName(String database) {
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Database name cannot be null or empty");
        }
        String trimmed = database.trim();
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format("Invalid database name format: '%s'", trimmed));
        }
        return trimmed;
    }

    public static String validateHost(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        String trimmed = host.trim();
        if (!VALID_HOST_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format("Invalid host: '%s'", trimmed));
        }
        return trimmed;
    }

    public static int validatePort(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(String.format("Port must be between 1 and 65535, got: %d", port));
        }
        return port;
    }

    // ============================================================================
    // Files
    // ============================================================================

    /**
     * Replaces path separators, NUL and characters unsafe on common file systems; caps the length
     * at 200 characters while keeping the extension.
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null) {
            return "";
        }
        String cleaned = filename.replace('/', '_').replace('\\', '_').replace("\0", "");
        cleaned = UNSAFE_FILENAME_CHARS.matcher(cleaned).replaceAll("_");
        if (cleaned.length() > MAX_FILENAME_LENGTH) {
            int dot = cleaned.lastIndexOf('.');
            if (dot > 0) {
                String ext = cleaned.substring(dot + 1);
                cleaned = cleaned.substring(0, MAX_FILENAME_LENGTH - 4) + "." + ext;
            } else {
                cleaned = cleaned.substring(0, MAX_FILENAME_LENGTH);
            }
        }
        return cleaned;
    }

    /** Lower-case extension without the dot, or empty when there is none. */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 || dot == filename.length() - 1 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException when the extension is not in {@code allowed}
     */
    public static String validateFileExtension(String filename, Collection<String> allowed) {
        String ext = extensionOf(filename);
        if (!allowed.contains(ext)) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported file type: '%s'. Allowed: %s", ext.isEmpty() ? "<none>" : "." + ext, allowed));
        }
        return ext;
    }

    // ============================================================================
    // Utility Methods
    // ============================================================================

    /**
     * Sanitizes a string for logging (removes sensitive information).
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        if (input.contains("password=")) {
            return input.replaceAll("password=[^;&]+", "password=***");
        }
        return input;
    }

    private static String abbreviate(String text) {
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }
}
