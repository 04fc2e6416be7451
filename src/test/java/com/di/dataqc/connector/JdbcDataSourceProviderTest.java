package com.di.dataqc.connector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for JdbcDataSourceProvider pool naming and JdbcConnectionSnapshot.
 */
@DisplayName("JdbcDataSourceProvider Tests")
class JdbcDataSourceProviderTest {

    private static JdbcConnectionSnapshot snapshot(String url, String user) {
        return new JdbcConnectionSnapshot(url, user, "secret", "org.postgresql.Driver", 4, 30_000);
    }

    @Test
    @DisplayName("Should derive a short pool name from host, database and user")
    void testShortPoolKey() {
        assertEquals("db_local_sales_bob",
                JdbcDataSourceProvider.shortPoolKey(snapshot("jdbc:postgresql://db.local:5432/sales", "bob")));
        assertEquals("db_local_sales_bob",
                JdbcDataSourceProvider.shortPoolKey(snapshot("jdbc:postgresql://db.local/sales?ssl=true", "bob")));
        assertEquals("unknown", JdbcDataSourceProvider.shortPoolKey(snapshot(null, null)));
    }

    @Test
    @DisplayName("Should keep the password out of toString")
    void testSnapshotToString() {
        JdbcConnectionSnapshot snapshot = snapshot("jdbc:postgresql://db.local:5432/sales", "bob");
        assertFalse(snapshot.toString().contains("secret"));
        assertEquals("jdbc:postgresql://db.local:5432/sales|bob", snapshot.connectionKey());
    }
}
