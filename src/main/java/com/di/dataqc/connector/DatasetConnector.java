package com.di.dataqc.connector;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ConnectorException;

/**
 * Loads a {@link Dataset} from an external source.
 *
 * <p>Implementations are Spring beans discovered by {@link ConnectorRegistry} and selected by
 * {@link #type()} (case-insensitive).
 */
public interface DatasetConnector {

    /**
     * Connector type as used in requests ({@code file}, {@code postgres}).
     */
    String type();

    /**
     * Reads the source described by {@code request} into memory.
     *
     * @throws ConnectorException when the source cannot be read
     * @throws IllegalArgumentException when the request itself is malformed
     */
    Dataset load(ConnectorRequest request);

    /**
     * Checks that the source is reachable without loading data.
     */
    default void testConnection(ConnectorRequest request) {
        throw new ConnectorException(type(), "Connection test is not supported for source type: " + type());
    }
}
