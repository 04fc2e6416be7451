package com.di.dataqc.connector;

import com.di.dataqc.exception.ConnectorException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Registry of {@link DatasetConnector} beans keyed by normalized type (trimmed, lower case).
 *
 * <p>Duplicate or blank connector types fail application startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectorRegistry {

    private final List<DatasetConnector> connectors;

    private Map<String, DatasetConnector> connectorsByType;

    @PostConstruct
    void initialize() {
        if (connectors == null || connectors.isEmpty()) {
            log.warn("[CONNECTOR] No DatasetConnector beans found. Registry will be empty.");
            connectorsByType = Collections.emptyMap();
            return;
        }

        connectors.forEach(connector -> log.info("[CONNECTOR]   - {} (type='{}')",
                connector.getClass().getName(), connector.type() == null ? "<null>" : connector.type()));

        Map<String, List<DatasetConnector>> grouped = connectors.stream()
                .peek(ConnectorRegistry::validateType)
                .collect(Collectors.groupingBy(connector -> normalizeType(connector.type())));

        List<Map.Entry<String, List<DatasetConnector>>> duplicates = grouped.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 1)
                .toList();
        if (!duplicates.isEmpty()) {
            String detail = duplicates.stream()
                    .map(entry -> String.format("'%s' -> [%s]", entry.getKey(), entry.getValue().stream()
                            .map(connector -> connector.getClass().getName())
                            .collect(Collectors.joining(", "))))
                    .collect(Collectors.joining(" ; "));
            throw new IllegalStateException("Duplicate DatasetConnector type() values detected: " + detail);
        }

        connectorsByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> entry.getValue().get(0)));
        log.info("[CONNECTOR] Registered {} connector type(s): {}", connectorsByType.size(), getRegisteredTypes());
    }

    /**
     * @throws ConnectorException when no connector handles {@code type}
     */
    public DatasetConnector getConnector(String type) {
        if (type == null || type.isBlank()) {
            throw new ConnectorException(String.valueOf(type), "Source type cannot be null or blank");
        }
        DatasetConnector connector = connectorsByType.get(normalizeType(type));
        if (connector == null) {
            throw new ConnectorException(type, String.format("Unsupported source type: '%s'. Available types: %s",
                    type, getRegisteredTypes()));
        }
        return connector;
    }

    /** Registered types, sorted. */
    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(connectorsByType.keySet()));
    }

    public boolean hasConnector(String type) {
        return type != null && !type.isBlank() && connectorsByType.containsKey(normalizeType(type));
    }

    private static void validateType(DatasetConnector connector) {
        String type = connector.type();
        if (type == null || type.isBlank()) {
            throw new IllegalStateException(String.format(
                    "Connector %s returned blank type(). Connector type must be non-null and non-blank.",
                    connector.getClass().getName()));
        }
    }

    private static String normalizeType(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
