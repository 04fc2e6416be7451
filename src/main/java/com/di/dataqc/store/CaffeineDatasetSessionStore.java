package com.di.dataqc.store;

import com.di.dataqc.config.QcProperties;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ResourceNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * In-memory {@link DatasetSessionStore}, bounded by {@code dataqc.sessions.max-size} and expiring
 * {@code dataqc.sessions.expire-after-minutes} after write.
 * <p>
 * Name allocation and rename are synchronized so two saves cannot claim the same display name.
 */
@Slf4j
@Service
public class CaffeineDatasetSessionStore implements DatasetSessionStore {

    private final Cache<String, DatasetSession> sessions;

    @Autowired
    public CaffeineDatasetSessionStore(QcProperties properties) {
        this(properties.getSessions().getMaxSize(), properties.getSessions().getExpireAfterMinutes());
    }

    CaffeineDatasetSessionStore(long maxSize, long expireAfterMinutes) {
        this.sessions = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterMinutes, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public synchronized DatasetSession save(String name, String sourceType, Dataset dataset, String origin) {
        DatasetSession session = DatasetSession.builder()
                .id(UUID.randomUUID().toString())
                .name(uniqueName(requireName(name), null))
                .sourceType(sourceType)
                .origin(origin)
                .dataset(dataset)
                .build();
        sessions.put(session.getId(), session);
        log.info("[STORE] Session {} '{}' saved: {}", session.getId(), session.getName(), dataset);
        return session;
    }

    @Override
    public Optional<DatasetSession> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return Optional.ofNullable(sessions.getIfPresent(id));
    }

    @Override
    public DatasetSession getRequired(String id) {
        return findById(id).orElseThrow(() -> new ResourceNotFoundException("Source", id));
    }

    @Override
    public List<DatasetSession> list() {
        return sessions.asMap().values().stream()
                .sorted(Comparator.comparing(DatasetSession::getCreatedAt).thenComparing(DatasetSession::getName))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized DatasetSession rename(String id, String newName) {
        DatasetSession current = getRequired(id);
        DatasetSession renamed = current.toBuilder().name(uniqueName(requireName(newName), id)).build();
        sessions.put(id, renamed);
        log.info("[STORE] Session {} renamed to '{}'", id, renamed.getName());
        return renamed;
    }

    @Override
    public boolean delete(String id) {
        if (id == null) return false;
        boolean removed = sessions.asMap().remove(id) != null;
        if (removed) {
            log.info("[STORE] Session {} deleted", id);
        }
        return removed;
    }

    private String uniqueName(String base, String excludeId) {
        Set<String> taken = sessions.asMap().values().stream()
                .filter(s -> !s.getId().equals(excludeId))
                .map(DatasetSession::getName)
                .collect(Collectors.toSet());
        if (!taken.contains(base)) {
            return base;
        }
        int counter = 1;
        while (taken.contains(base + " (" + counter + ")")) {
            counter++;
        }
        return base + " (" + counter + ")";
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new RuleConfigurationException("Name is required");
        }
        return name.trim();
    }
}
