package com.di.dataqc.connector;

/**
 * Immutable connection settings for one pooled database target.
 */
public record JdbcConnectionSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                                     int maximumPoolSize, long connectionTimeoutMs) {

    /** Pool cache key: URL and user. */
    public String connectionKey() {
        return jdbcUrl + "|" + username;
    }

    @Override
    public String toString() {
        return "JdbcConnectionSnapshot[jdbcUrl=" + jdbcUrl + ", username=" + username
                + ", maximumPoolSize=" + maximumPoolSize + "]";
    }
}
