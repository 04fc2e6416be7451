package com.di.dataqc.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One immutable result of a rule batch, comparison, reconciliation or formula calculation.
 */
@Value
@Builder(toBuilder = true)
public class StoredResult {

    /** Assigned by the {@link ResultStore} on save. */
    String id;

    ResultType type;

    /** Session ids the result was computed from. */
    @Builder.Default
    List<String> sourceIds = List.of();

    @Builder.Default
    Instant createdAt = Instant.now();

    /** {@code RuleBatchResult}, {@code ComparisonResult}, {@code ReconciliationResult} or {@code FormulaResult}. */
    Object payload;

    /**
     * Payload cast to {@code type}.
     *
     * @throws IllegalStateException when the payload is of another type
     */
    public <T> T payload(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Result " + id + " holds " + this.type + ", not " + type.getSimpleName());
        }
        return type.cast(payload);
    }
}
