package com.di.dataqc.connector;

import com.di.dataqc.util.InputValidator;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One HikariCP pool per distinct JDBC URL and user. Pools live until shutdown or {@link #close}.
 */
@Slf4j
@Component
public class JdbcDataSourceProvider {

    private final ConcurrentMap<String, HikariDataSource> dataSourceCache = new ConcurrentHashMap<>();

    private final AtomicInteger poolIdCounter = new AtomicInteger(0);

    public DataSource getOrInit(JdbcConnectionSnapshot snapshot) {
        return dataSourceCache.computeIfAbsent(snapshot.connectionKey(), key -> {
            log.info("[CONNECTOR] Creating HikariCP pool for {} (user: {}, maxPoolSize={})",
                    InputValidator.sanitizeForLogging(snapshot.jdbcUrl()), snapshot.username(),
                    snapshot.maximumPoolSize());

            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            if (snapshot.driverClassName() != null) {
                hikariConfig.setDriverClassName(snapshot.driverClassName());
            }
            hikariConfig.setMaximumPoolSize(Math.max(1, snapshot.maximumPoolSize()));
            hikariConfig.setMinimumIdle(0);
            hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            hikariConfig.setReadOnly(true);
            // fail on first use instead of at pool construction
            hikariConfig.setInitializationFailTimeout(-1);
            if (snapshot.jdbcUrl() != null && snapshot.jdbcUrl().contains("postgresql")) {
                hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            }
            hikariConfig.setPoolName("dataqc-pool-" + poolIdCounter.incrementAndGet() + "-" + shortPoolKey(snapshot));
            return new HikariDataSource(hikariConfig);
        });
    }

    /**
     * Closes and forgets the pool for {@code snapshot}, e.g. after an authentication failure.
     */
    public void close(JdbcConnectionSnapshot snapshot) {
        HikariDataSource dataSource = dataSourceCache.remove(snapshot.connectionKey());
        if (dataSource != null) {
            dataSource.close();
            log.info("[CONNECTOR] Closed pool {}", dataSource.getPoolName());
        }
    }

    public int poolCount() {
        return dataSourceCache.size();
    }

    @PreDestroy
    public void closeAll() {
        log.info("[CONNECTOR] Closing all pools (count: {})", dataSourceCache.size());
        dataSourceCache.values().forEach(HikariDataSource::close);
        dataSourceCache.clear();
    }

    /** {@code host_db_user} from {@code jdbc:postgresql://host:port/db}, safe for pool names. */
    static String shortPoolKey(JdbcConnectionSnapshot snapshot) {
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        String url = snapshot.jdbcUrl();
        if (url == null || url.isBlank()) {
            return user.replaceAll("[^a-zA-Z0-9_]", "_");
        }
        String part = url;
        int slashSlash = url.indexOf("//");
        if (slashSlash >= 0) {
            part = url.substring(slashSlash + 2);
        }
        int slashDb = part.indexOf('/');
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split(":")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }
}
