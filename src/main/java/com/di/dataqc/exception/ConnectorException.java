package com.di.dataqc.exception;

/**
 * A connector could not produce a dataset: unreadable file, unknown connector type, database error.
 */
public class ConnectorException extends QcException {

    private final String connectorType;

    public ConnectorException(String connectorType, String message) {
        super(message);
        this.connectorType = connectorType;
    }

    public ConnectorException(String connectorType, String message, Throwable cause) {
        super(message, cause);
        this.connectorType = connectorType;
    }

    public String getConnectorType() {
        return connectorType;
    }
}
