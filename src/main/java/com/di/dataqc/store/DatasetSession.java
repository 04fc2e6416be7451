package com.di.dataqc.store;

import com.di.dataqc.dataset.Dataset;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A loaded dataset and where it came from.
 */
@Value
@Builder(toBuilder = true)
public class DatasetSession {

    String id;

    /** Display name, unique among live sessions. */
    String name;

    /** Connector type that produced the dataset, e.g. {@code file} or {@code postgres}. */
    String sourceType;

    /** File name or query text. */
    String origin;

    Dataset dataset;

    @Builder.Default
    Instant createdAt = Instant.now();
}
