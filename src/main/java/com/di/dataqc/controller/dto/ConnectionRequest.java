package com.di.dataqc.controller.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request body for POST /api/data/test-connection: database coordinates only.
 */
@Data
@NoArgsConstructor
public class ConnectionRequest {

    /** Connector type; only {@code postgres} reads from a database. */
    private String source = "postgres";

    private String host;

    private Integer port;

    private String database;

    private String user;

    @ToString.Exclude
    private String password;
}
