package com.di.dataqc.store;

import com.di.dataqc.dataset.Dataset;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store of loaded datasets.
 */
public interface DatasetSessionStore {

    /** Stores {@code dataset} under a new id; {@code name} is suffixed {@code (1)}, {@code (2)}, ... if already taken. */
    DatasetSession save(String name, String sourceType, Dataset dataset, String origin);

    Optional<DatasetSession> findById(String id);

    /**
     * @throws com.di.dataqc.exception.ResourceNotFoundException when absent or expired
     */
    DatasetSession getRequired(String id);

    /** Live sessions, oldest first. */
    List<DatasetSession> list();

    DatasetSession rename(String id, String newName);

    boolean delete(String id);
}
