package com.di.dataqc.aspect;

import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.exception.ConnectorException;
import com.di.dataqc.exception.ResourceNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories for operation event logging and error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Rule or request configuration is missing or invalid"),
    VALIDATION_ERROR("Validation error", "Input validation failed or referenced columns are absent"),
    NOT_FOUND("Not found", "Requested session or result does not exist or has expired"),
    CONNECTOR_ERROR("Connector error", "Data source could not be read"),
    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to perform operation"),
    DATABASE_ERROR("Database error", "General database operation error"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    SERIALIZATION_ERROR("Serialization error", "Request or response body could not be converted"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** First match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof RuleConfigurationException, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(t -> t instanceof ResourceNotFoundException, NOT_FOUND);
        MATCHERS.put(t -> t instanceof ConnectorException, CONNECTOR_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof SQLException) {
            return categorizeSqlException((SQLException) exception);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase(Locale.ROOT);
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied", "authentication")) return PERMISSION_ERROR;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "28", PERMISSION_ERROR,
            "42", SQL_SYNTAX_ERROR,
            "57", TIMEOUT_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isValidationError(Throwable t) {
        return t instanceof ColumnNotFoundException
                || t instanceof IllegalArgumentException
                || t instanceof jakarta.validation.ValidationException
                || t instanceof org.springframework.validation.BindException
                || t instanceof org.springframework.beans.TypeMismatchException
                || t instanceof org.springframework.web.bind.ServletRequestBindingException
                || t instanceof org.springframework.web.multipart.support.MissingServletRequestPartException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException
                || t instanceof org.springframework.http.converter.HttpMessageNotWritableException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException
                || t instanceof org.springframework.web.multipart.MaxUploadSizeExceededException;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
