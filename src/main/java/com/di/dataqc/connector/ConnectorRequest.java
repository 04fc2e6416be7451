package com.di.dataqc.connector;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Everything a connector may need to load one dataset. File connectors read {@code filename},
 * {@code content} and {@code delimiter}; database connectors read the connection fields and {@code query}.
 */
@Value
@Builder
public class ConnectorRequest {

    String type;

    String name;

    // file
    String filename;
    @ToString.Exclude
    byte[] content;
    @Builder.Default
    String delimiter = ",";

    // database
    String host;
    @Builder.Default
    int port = 5432;
    String database;
    String user;
    @ToString.Exclude
    String password;
    String query;

    /** Delimiter as a single character; blank means comma, {@code \t} and {@code tab} mean tab. */
    public char delimiterChar() {
        if (delimiter == null || delimiter.isEmpty()) {
            return ',';
        }
        if ("\\t".equals(delimiter) || "tab".equalsIgnoreCase(delimiter)) {
            return '\t';
        }
        if (delimiter.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character, got: '" + delimiter + "'");
        }
        return delimiter.charAt(0);
    }
}
