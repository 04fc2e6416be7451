package com.di.dataqc.exception;

/**
 * Base class for failures raised by the quality-check engine. Every subclass is scoped to the single
 * operation that raised it.
 */
public class QcException extends RuntimeException {

    public QcException(String message) {
        super(message);
    }

    public QcException(String message, Throwable cause) {
        super(message, cause);
    }
}
