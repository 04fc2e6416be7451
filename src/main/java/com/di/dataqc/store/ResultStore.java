package com.di.dataqc.store;

import java.util.Optional;

/**
 * Keyed store of computed results.
 */
public interface ResultStore {

    /** Saves {@code result} under a new id and returns that id. */
    String save(StoredResult result);

    Optional<StoredResult> findById(String id);

    /**
     * @throws com.di.dataqc.exception.ResourceNotFoundException when absent or expired
     */
    StoredResult getRequired(String id);

    boolean delete(String id);
}
