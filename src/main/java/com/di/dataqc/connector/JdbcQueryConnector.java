package com.di.dataqc.connector;

import com.di.dataqc.aspect.LogOperation;
import com.di.dataqc.config.QcProperties;
import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.ColumnType;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.dataset.TypeConverter;
import com.di.dataqc.exception.ConnectorException;
import com.di.dataqc.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a single read-only SELECT against PostgreSQL and materializes the result set.
 * Column types come from the result set metadata.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcQueryConnector implements DatasetConnector {

    public static final String TYPE = "postgres";

    private static final String DRIVER_CLASS = "org.postgresql.Driver";

    private final JdbcDataSourceProvider dataSourceProvider;
    private final QcProperties properties;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    @LogOperation(eventType = "QUERY_LOAD")
    public Dataset load(ConnectorRequest request) {
        String query = InputValidator.validateSelectQuery(request.getQuery());
        JdbcConnectionSnapshot snapshot = snapshot(request);
        log.info("[CONNECTOR] Executing query on {}: {}", InputValidator.sanitizeForLogging(snapshot.jdbcUrl()),
                query.length() > 200 ? query.substring(0, 200) + "..." : query);
        try {
            Dataset dataset = template(snapshot).query(query, resultSetToDataset());
            log.info("[CONNECTOR] Query returned {} rows x {} columns",
                    dataset == null ? 0 : dataset.rowCount(), dataset == null ? 0 : dataset.columnCount());
            return dataset == null ? Dataset.empty() : dataset;
        } catch (DataAccessException e) {
            throw new ConnectorException(TYPE, "Query execution failed: " + rootMessage(e), e);
        }
    }

    @Override
    public void testConnection(ConnectorRequest request) {
        JdbcConnectionSnapshot snapshot = snapshot(request);
        try {
            template(snapshot).queryForObject("SELECT 1", Integer.class);
            log.info("[CONNECTOR] Connection test succeeded for {}", snapshot.jdbcUrl());
        } catch (DataAccessException e) {
            dataSourceProvider.close(snapshot);
            throw new ConnectorException(TYPE, "Connection failed: " + rootMessage(e), e);
        }
    }

    JdbcConnectionSnapshot snapshot(ConnectorRequest request) {
        String host = InputValidator.validateHost(request.getHost());
        int port = InputValidator.validatePort(request.getPort());
        String database = InputValidator.validateDatabaseName(request.getDatabase());
        if (request.getUser() == null || request.getUser().isBlank()) {
            throw new IllegalArgumentException("User cannot be null or empty");
        }
        QcProperties.Jdbc jdbc = properties.getJdbc();
        return new JdbcConnectionSnapshot(
                "jdbc:postgresql://" + host + ":" + port + "/" + database,
                request.getUser().trim(),
                request.getPassword(),
                DRIVER_CLASS,
                jdbc.getMaximumPoolSize(),
                jdbc.getConnectionTimeoutMs());
    }

    private JdbcTemplate template(JdbcConnectionSnapshot snapshot) {
        JdbcTemplate template = new JdbcTemplate(dataSourceProvider.getOrInit(snapshot));
        template.setQueryTimeout(properties.getJdbc().getQueryTimeoutSeconds());
        return template;
    }

    private static ResultSetExtractor<Dataset> resultSetToDataset() {
        return rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            int columnCount = meta.getColumnCount();
            List<String> names = new ArrayList<>(columnCount);
            Dataset.Builder builder = Dataset.builder();
            for (int i = 1; i <= columnCount; i++) {
                String name = meta.getColumnLabel(i);
                names.add(name);
                ColumnType type = TypeConverter.fromSqlTypeName(meta.getColumnTypeName(i));
                builder.column(name, type == ColumnType.MIXED ? null : type);
            }
            while (rs.next()) {
                List<CellValue> cells = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    cells.add(TypeConverter.fromJdbc(rs.getObject(i), names.get(i - 1)));
                }
                builder.cells(cells);
            }
            return builder.build();
        };
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
