package com.di.dataqc.exception;

/**
 * A required option is missing or an option is structurally invalid (wrong type, empty set,
 * unknown keyword, invalid regex).
 */
public class RuleConfigurationException extends QcException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static RuleConfigurationException missingField(String field) {
        return new RuleConfigurationException("Missing required config field: " + field);
    }
}
