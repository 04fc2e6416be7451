package com.di.dataqc.store;

import com.di.dataqc.config.QcProperties;
import com.di.dataqc.exception.ResourceNotFoundException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * In-memory {@link ResultStore}, bounded by {@code dataqc.results.max-size} and expiring
 * {@code dataqc.results.expire-after-minutes} after write.
 */
@Slf4j
@Service
public class CaffeineResultStore implements ResultStore {

    private final Cache<String, StoredResult> results;

    @Autowired
    public CaffeineResultStore(QcProperties properties) {
        this(properties.getResults().getMaxSize(), properties.getResults().getExpireAfterMinutes());
    }

    CaffeineResultStore(long maxSize, long expireAfterMinutes) {
        this.results = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterMinutes, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public String save(StoredResult result) {
        String id = UUID.randomUUID().toString();
        results.put(id, result.toBuilder().id(id).build());
        log.info("[STORE] Saved {} result {}", result.getType().id(), id);
        return id;
    }

    @Override
    public Optional<StoredResult> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return Optional.ofNullable(results.getIfPresent(id));
    }

    @Override
    public StoredResult getRequired(String id) {
        return findById(id).orElseThrow(() -> new ResourceNotFoundException("Result", id));
    }

    @Override
    public boolean delete(String id) {
        if (id == null) return false;
        return results.asMap().remove(id) != null;
    }
}
