package com.di.dataqc.aspect;

import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.exception.ConnectorException;
import com.di.dataqc.exception.ResourceNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;
import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    @Test
    @DisplayName("Should categorize application exceptions")
    void testApplicationExceptions() {
        assertEquals(ErrorCategory.CONFIGURATION_ERROR,
                ErrorCategory.categorize(new RuleConfigurationException("bad rule")));
        assertEquals(ErrorCategory.VALIDATION_ERROR,
                ErrorCategory.categorize(new ColumnNotFoundException(List.of("amount"))));
        assertEquals(ErrorCategory.VALIDATION_ERROR,
                ErrorCategory.categorize(new IllegalArgumentException("bad input")));
        assertEquals(ErrorCategory.NOT_FOUND,
                ErrorCategory.categorize(new ResourceNotFoundException("Result", "abc")));
        assertEquals(ErrorCategory.CONNECTOR_ERROR,
                ErrorCategory.categorize(new ConnectorException("file", "unreadable")));
    }

    @Test
    @DisplayName("Should categorize infrastructure exceptions")
    void testInfrastructureExceptions() {
        assertEquals(ErrorCategory.SERIALIZATION_ERROR,
                ErrorCategory.categorize(new JsonParseException(null, "bad json")));
        assertEquals(ErrorCategory.TIMEOUT_ERROR, ErrorCategory.categorize(new SocketTimeoutException()));
        assertEquals(ErrorCategory.NETWORK_ERROR, ErrorCategory.categorize(new ConnectException()));
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new IllegalStateException()));
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @ParameterizedTest
    @CsvSource({
            "08001, CONNECTION_ERROR",
            "28P01, PERMISSION_ERROR",
            "42601, SQL_SYNTAX_ERROR",
            "57014, TIMEOUT_ERROR",
            "23505, DATABASE_ERROR"
    })
    @DisplayName("Should categorize SQL exceptions by SQL state")
    void testSqlState(String sqlState, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(new SQLException("failure", sqlState)));
    }

    @Test
    @DisplayName("Should fall back to the SQL message without a state")
    void testSqlMessage() {
        assertEquals(ErrorCategory.CONNECTION_ERROR,
                ErrorCategory.categorize(new SQLException("Connection refused")));
        assertEquals(ErrorCategory.PERMISSION_ERROR,
                ErrorCategory.categorize(new SQLException("password authentication failed")));
        assertEquals(ErrorCategory.DATABASE_ERROR, ErrorCategory.categorize(new SQLException("boom")));
    }
}
